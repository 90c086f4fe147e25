package com.alleato.insights.service;

import com.alleato.insights.model.QueueMonitorEntry;
import com.alleato.insights.model.QueueStats;

import java.util.List;
import java.util.UUID;

public interface ProcessingQueueService {

    /**
     * @return {@code false} when the document is already queued or already has insights
     */
    boolean enqueue(UUID documentId, String title);

    /**
     * Classifies the stored document and queues it if it looks like a transcript.
     */
    boolean submitIfTranscript(UUID documentId);

    /**
     * Queues the document even if it has insights; the worker replaces them.
     */
    boolean forceReprocess(UUID documentId);

    QueueStats stats();

    int resetFailed();

    int cleanupCompleted(int olderThanDays);

    int backfillUnprocessed();

    List<QueueMonitorEntry> findRecent(int limit);
}
