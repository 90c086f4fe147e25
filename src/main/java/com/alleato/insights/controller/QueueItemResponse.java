package com.alleato.insights.controller;

import com.alleato.insights.model.QueueMonitorEntry;
import com.alleato.insights.model.QueueStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record QueueItemResponse(
    long id,
    @JsonProperty("document_id") UUID documentId,
    @JsonProperty("document_title") String documentTitle,
    QueueStatus status,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("created_at") OffsetDateTime createdAt,
    @JsonProperty("started_at") OffsetDateTime startedAt,
    @JsonProperty("completed_at") OffsetDateTime completedAt,
    @JsonProperty("processing_seconds") Long processingSeconds,
    @JsonProperty("existing_insights_count") long existingInsightsCount,
    Map<String, Object> metadata
) {

    static QueueItemResponse from(QueueMonitorEntry entry) {
        var item = entry.item();
        return new QueueItemResponse(
            item.id(),
            item.documentId(),
            item.documentTitle(),
            item.status(),
            item.retryCount(),
            item.errorMessage(),
            item.createdAt(),
            item.startedAt(),
            item.completedAt(),
            entry.processingTime() != null ? entry.processingTime().toSeconds() : null,
            entry.existingInsightsCount(),
            item.metadata()
        );
    }
}
