package com.alleato.insights.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Restrictions on the parent document of a chunk. {@code null} fields do not filter.
 * The date range applies to {@code occurred_at}.
 */
public record SearchFilters(
    String source,
    String category,
    @JsonProperty("project_id") UUID projectId,
    @JsonProperty("occurred_from") OffsetDateTime occurredFrom,
    @JsonProperty("occurred_to") OffsetDateTime occurredTo
) {

    public static SearchFilters none() {
        return new SearchFilters(null, null, null, null, null);
    }
}
