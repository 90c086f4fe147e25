package com.alleato.insights.worker;

import com.alleato.insights.exception.EntityNotFoundException;
import com.alleato.insights.extraction.InsightAssembler;
import com.alleato.insights.extraction.InsightExtractor;
import com.alleato.insights.model.ClaimedItem;
import com.alleato.insights.model.Document;
import com.alleato.insights.model.Insight;
import com.alleato.insights.repository.DocumentRepository;
import com.alleato.insights.service.ChunkIndexingService;
import com.alleato.insights.service.DequeueCoordinator;
import com.alleato.insights.service.InsightService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Claims queued documents and turns each into insights and search chunks. Every claim
 * ends in exactly one {@code complete} call, whatever happens in between.
 */
@Slf4j
@Component
public class InsightWorker {

    private final DequeueCoordinator coordinator;
    private final DocumentRepository documentRepository;
    private final InsightExtractor extractor;
    private final InsightAssembler assembler;
    private final InsightService insightService;
    private final ChunkIndexingService chunkIndexingService;

    @Value("${app.worker.batch-size:20}")
    private int batchSize;

    public InsightWorker(
        DequeueCoordinator coordinator,
        DocumentRepository documentRepository,
        InsightExtractor extractor,
        InsightAssembler assembler,
        InsightService insightService,
        ChunkIndexingService chunkIndexingService
    ) {
        this.coordinator = coordinator;
        this.documentRepository = documentRepository;
        this.extractor = extractor;
        this.assembler = assembler;
        this.insightService = insightService;
        this.chunkIndexingService = chunkIndexingService;
    }

    @Scheduled(
        initialDelayString = "${app.worker.poll-interval-ms:15000}",
        fixedDelayString = "${app.worker.poll-interval-ms:15000}"
    )
    public void poll() {
        log.debug("Polling insights queue...");
        int processed = drain();
        if (processed > 0) {
            log.info("Processed {} queued documents", processed);
        }
    }

    /**
     * Processes queued items until the queue is empty or one batch is done.
     *
     * @return number of items claimed
     */
    public int drain() {
        int processed = 0;
        while (processed < batchSize) {
            Optional<ClaimedItem> claimed = coordinator.claimNext();
            if (claimed.isEmpty()) {
                break;
            }
            process(claimed.get());
            processed++;
        }
        return processed;
    }

    void process(ClaimedItem item) {
        log.info("Extracting insights for doc {} (queue item {}, attempt {})",
            item.documentId(), item.queueId(), item.attempt());

        int stored;
        try {
            stored = extractAndStore(item);
        } catch (Exception e) {
            log.error("FAILED to process doc {} (queue item {}): {}", item.documentId(), item.queueId(), e.getMessage(), e);
            finish(item, false, describe(e), 0);
            return;
        }
        finish(item, true, null, stored);
    }

    private int extractAndStore(ClaimedItem item) {
        Document document = documentRepository.findById(item.documentId())
            .orElseThrow(() -> new EntityNotFoundException("Document", item.documentId()));

        if (!item.forceReprocess() && insightService.hasInsights(document.id())) {
            log.info("Doc {} already has insights, skipping extraction", document.id());
            return 0;
        }

        List<Insight> insights = assembler.assemble(document, extractor.extract(document));
        chunkIndexingService.reindex(document);
        return insightService.store(document.id(), insights, item.forceReprocess());
    }

    private void finish(ClaimedItem item, boolean success, String error, int insightCount) {
        try {
            coordinator.complete(item.queueId(), success, error, insightCount);
        } catch (EntityNotFoundException e) {
            // The document was deleted, taking its queue row with it
            log.warn("Queue item {} vanished before completion: {}", item.queueId(), e.getMessage());
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
