package com.alleato.insights.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DocumentChunk(
    UUID id,
    @JsonProperty("document_id") UUID documentId,
    @JsonProperty("chunk_index") int chunkIndex,
    String content,
    String speaker,
    @JsonProperty("start_time") Double startTime,
    @JsonProperty("end_time") Double endTime,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {}
