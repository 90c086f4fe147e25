package com.alleato.insights.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record DocumentRequest(
    @Size(max = 500)
    String title,

    @NotBlank
    String content,

    String source,

    String category,

    @JsonProperty("occurred_at")
    OffsetDateTime occurredAt,

    @JsonProperty("project_id")
    UUID projectId,

    // Free-text project name, resolved when no project_id is given
    @JsonProperty("project")
    String projectMention,

    List<String> participants,

    Map<String, Object> metadata
) {}
