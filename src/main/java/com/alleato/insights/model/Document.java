package com.alleato.insights.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An ingested content unit.
 *
 * <p>{@code occurredAt} is when the meeting or event took place and may be unknown;
 * {@code createdAt} is when the row was stored. Ranking by recency must use
 * {@code occurredAt}.
 */
public record Document(
    UUID id,
    String title,
    String content,
    String source,
    String category,
    OffsetDateTime occurredAt,
    UUID projectId,
    List<String> participants,
    String summary,
    Map<String, Object> metadata,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public static final String CATEGORY_MEETING = "meeting";
    public static final String CATEGORY_OTHER = "other";
}
