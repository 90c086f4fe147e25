package com.alleato.insights.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record Project(
    UUID id,
    String name,
    List<String> aliases,
    List<String> keywords,
    ProjectStatus status,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
