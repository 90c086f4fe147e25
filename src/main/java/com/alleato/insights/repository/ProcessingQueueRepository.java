package com.alleato.insights.repository;

import com.alleato.insights.model.ClaimedItem;
import com.alleato.insights.model.ProcessingQueueItem;
import com.alleato.insights.model.QueueMonitorEntry;
import com.alleato.insights.model.QueueStats;
import com.alleato.insights.model.QueueStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface ProcessingQueueRepository {

    /**
     * Inserts a PENDING row unless the document already has a PENDING or PROCESSING row,
     * or (when {@code requireNoInsights}) already has insights.
     *
     * @return whether a row was inserted
     */
    boolean enqueue(UUID documentId, String title, Map<String, Object> metadata, boolean requireNoInsights);

    Optional<ClaimedItem> claimNext(int maxRetries);

    /**
     * @return the new status, empty when the row is not currently PROCESSING
     */
    Optional<QueueStatus> markCompleted(long queueId, int insightCount);

    /**
     * @return the new status (PENDING or FAILED), empty when the row is not currently PROCESSING
     */
    Optional<QueueStatus> markAttemptFailed(long queueId, String errorMessage, int maxRetries);

    /**
     * Moves PROCESSING rows started before the threshold back to PENDING, or to FAILED
     * when they have used up their retries.
     *
     * @return documents whose rows went back to PENDING
     */
    List<UUID> reclaimStale(int staleThresholdMinutes, int maxRetries);

    Optional<ProcessingQueueItem> findById(long queueId);

    QueueStats stats();

    int resetFailed();

    int deleteCompletedOlderThan(int days);

    List<QueueMonitorEntry> findRecent(int limit);
}
