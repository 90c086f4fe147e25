package com.alleato.insights.listener;

import com.alleato.insights.event.DocumentIngestedEvent;
import com.alleato.insights.event.InsightsQueuedEvent;
import com.alleato.insights.service.ProcessingQueueService;
import com.alleato.insights.worker.InsightWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Slf4j
public class DocumentEventListener {

    private final ProcessingQueueService queueService;
    private final InsightWorker insightWorker;
    private final Executor executor;

    // At most one event-driven drain loop runs; queued events arriving meanwhile only
    // ask it for another pass.
    private final AtomicBoolean drainRunning = new AtomicBoolean(false);
    private final AtomicBoolean drainRequested = new AtomicBoolean(false);

    public DocumentEventListener(
        ProcessingQueueService queueService,
        InsightWorker insightWorker,
        @Qualifier("insightsTaskExecutor") Executor executor
    ) {
        this.queueService = queueService;
        this.insightWorker = insightWorker;
        this.executor = executor;
    }

    @Async("insightsTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleIngested(DocumentIngestedEvent event) {
        log.debug("Classifying newly stored doc: {}", event.documentId());
        try {
            queueService.submitIfTranscript(event.documentId());
        } catch (RuntimeException e) {
            // Backfill picks the document up later
            log.error("Could not queue doc {}: {}", event.documentId(), e.getMessage(), e);
        }
    }

    /**
     * Runs on the publishing thread and never throws, so enqueue callers are not affected
     * by the state of the executor.
     */
    @EventListener
    public void handleQueued(InsightsQueuedEvent event) {
        log.debug("Doc {} queued, requesting a drain", event.documentId());
        drainRequested.set(true);
        startDrainLoop();
    }

    private void startDrainLoop() {
        if (!drainRunning.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drainLoop);
        } catch (TaskRejectedException e) {
            drainRunning.set(false);
            log.warn("Drain not scheduled, the poll will pick the queue up: {}", e.getMessage());
        }
    }

    private void drainLoop() {
        do {
            try {
                while (drainRequested.getAndSet(false)) {
                    insightWorker.drain();
                }
            } catch (RuntimeException e) {
                log.error("Event-driven drain failed: {}", e.getMessage(), e);
            } finally {
                drainRunning.set(false);
            }
            // A request that landed after the last pass but before the flag was released
        } while (drainRequested.get() && drainRunning.compareAndSet(false, true));
    }
}
