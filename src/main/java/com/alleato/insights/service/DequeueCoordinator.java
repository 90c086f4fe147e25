package com.alleato.insights.service;

import com.alleato.insights.model.ClaimedItem;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Hands queue rows to workers. A row is given to at most one caller at a time, and a
 * caller never waits for a row another caller holds.
 */
public interface DequeueCoordinator {

    Optional<ClaimedItem> claimNext();

    /**
     * Finishes a claim. A failure puts the row back to PENDING, or to FAILED once the
     * retry cap is used up.
     *
     * @throws com.alleato.insights.exception.EntityNotFoundException for an unknown queue id
     */
    void complete(long queueId, boolean success, String errorMessage, int insightCount);

    /**
     * @return documents whose stale rows went back to PENDING
     */
    List<UUID> reclaimStale(Duration staleAfter);
}
