package com.alleato.insights.model;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A queue row handed to exactly one worker. The worker owes one
 * {@code complete} call per claim.
 */
public record ClaimedItem(
    long queueId,
    UUID documentId,
    String title,
    OffsetDateTime createdAt,
    int attempt,
    boolean forceReprocess
) {}
