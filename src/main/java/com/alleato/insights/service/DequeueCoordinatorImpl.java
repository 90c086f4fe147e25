package com.alleato.insights.service;

import com.alleato.insights.config.QueueProperties;
import com.alleato.insights.exception.EntityNotFoundException;
import com.alleato.insights.model.ClaimedItem;
import com.alleato.insights.model.QueueStatus;
import com.alleato.insights.repository.ProcessingQueueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DequeueCoordinatorImpl implements DequeueCoordinator {

    static final int MAX_ERROR_LENGTH = 2000;

    private final ProcessingQueueRepository queueRepository;
    private final QueueProperties queueProperties;

    @Override
    public Optional<ClaimedItem> claimNext() {
        Optional<ClaimedItem> claimed = queueRepository.claimNext(queueProperties.maxRetries());
        claimed.ifPresent(item -> log.debug("Claimed queue item {} for doc {} (attempt {})",
            item.queueId(), item.documentId(), item.attempt()));
        return claimed;
    }

    @Override
    public void complete(long queueId, boolean success, String errorMessage, int insightCount) {
        Optional<QueueStatus> newStatus = success
            ? queueRepository.markCompleted(queueId, insightCount)
            : queueRepository.markAttemptFailed(queueId, truncate(errorMessage), queueProperties.maxRetries());

        if (newStatus.isEmpty()) {
            var item = queueRepository.findById(queueId)
                .orElseThrow(() -> new EntityNotFoundException("Queue item", queueId));
            // Reclaimed by the stale sweep while this worker was still busy
            log.warn("Queue item {} is {} and no longer held by this worker, ignoring completion",
                queueId, item.status());
            return;
        }

        switch (newStatus.get()) {
            case COMPLETED -> log.info("Queue item {} completed with {} insights", queueId, insightCount);
            case FAILED -> log.error("Queue item {} failed permanently: {}", queueId, errorMessage);
            default -> log.warn("Queue item {} failed, will retry: {}", queueId, errorMessage);
        }
    }

    @Override
    public List<UUID> reclaimStale(Duration staleAfter) {
        int minutes = (int) Math.max(1, staleAfter.toMinutes());
        List<UUID> reclaimed = queueRepository.reclaimStale(minutes, queueProperties.maxRetries());
        if (!reclaimed.isEmpty()) {
            log.info("Reclaimed {} stale queue items older than {} min", reclaimed.size(), minutes);
        }
        return reclaimed;
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Unknown error";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
