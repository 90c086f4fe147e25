package com.alleato.insights.controller;

import com.alleato.insights.model.SearchFilters;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SearchRequest(
    @NotBlank
    String query,

    @DecimalMin("0.0") @DecimalMax("1.0")
    Double threshold,

    @Min(1) @Max(100)
    Integer limit,

    String source,

    String category,

    @JsonProperty("project_id")
    UUID projectId,

    @JsonProperty("occurred_from")
    OffsetDateTime occurredFrom,

    @JsonProperty("occurred_to")
    OffsetDateTime occurredTo
) {

    SearchFilters filters() {
        return new SearchFilters(source, category, projectId, occurredFrom, occurredTo);
    }
}
