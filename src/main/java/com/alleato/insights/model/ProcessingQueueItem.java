package com.alleato.insights.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record ProcessingQueueItem(
    Long id,
    UUID documentId,
    String documentTitle,
    QueueStatus status,
    int retryCount,
    String errorMessage,
    OffsetDateTime createdAt,
    OffsetDateTime startedAt,
    OffsetDateTime completedAt,
    Map<String, Object> metadata
) {

    public static final String FORCE_REPROCESS = "force_reprocess";

    public boolean forceReprocess() {
        return metadata != null && Boolean.TRUE.equals(metadata.get(FORCE_REPROCESS));
    }
}
