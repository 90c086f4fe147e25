package com.alleato.insights.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record DocumentResponse(
    UUID id,

    String title,

    String content,

    String source,

    String category,

    @JsonProperty("occurred_at")
    OffsetDateTime occurredAt,

    @JsonProperty("project_id")
    UUID projectId,

    List<String> participants,

    String summary,

    Map<String, Object> metadata,

    @JsonProperty("created_at")
    OffsetDateTime createdAt
) {}
