package com.alleato.insights.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ParentDocument(
    UUID id,
    String title,
    String source,
    String category,
    @JsonProperty("occurred_at") OffsetDateTime occurredAt,
    List<String> participants,
    @JsonProperty("project_id") UUID projectId,
    @JsonProperty("project_name") String projectName
) {}
