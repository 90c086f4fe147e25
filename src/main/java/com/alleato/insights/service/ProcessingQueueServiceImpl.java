package com.alleato.insights.service;

import com.alleato.insights.classifier.TranscriptClassifier;
import com.alleato.insights.event.InsightsQueuedEvent;
import com.alleato.insights.exception.EntityNotFoundException;
import com.alleato.insights.exception.WrongQueryException;
import com.alleato.insights.model.Document;
import com.alleato.insights.model.ProcessingQueueItem;
import com.alleato.insights.model.QueueMonitorEntry;
import com.alleato.insights.model.QueueStats;
import com.alleato.insights.repository.DocumentRepository;
import com.alleato.insights.repository.ProcessingQueueRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
public class ProcessingQueueServiceImpl implements ProcessingQueueService {

    private static final int MAX_MONITOR_ROWS = 500;

    private final ProcessingQueueRepository queueRepository;
    private final DocumentRepository documentRepository;
    private final TranscriptClassifier classifier;
    private final ApplicationEventPublisher eventPublisher;
    private final int sampleChars;

    public ProcessingQueueServiceImpl(
        ProcessingQueueRepository queueRepository,
        DocumentRepository documentRepository,
        TranscriptClassifier classifier,
        ApplicationEventPublisher eventPublisher,
        @Value("${app.classifier.sample-chars:2000}") int sampleChars
    ) {
        this.queueRepository = queueRepository;
        this.documentRepository = documentRepository;
        this.classifier = classifier;
        this.eventPublisher = eventPublisher;
        this.sampleChars = sampleChars;
    }

    @Override
    public boolean enqueue(UUID documentId, String title) {
        return enqueue(documentId, title, false);
    }

    @Override
    public boolean submitIfTranscript(UUID documentId) {
        Document document = findDocument(documentId);
        if (!classifier.classify(document.title(), sample(document.content()))) {
            return false;
        }
        return enqueue(document.id(), document.title());
    }

    @Override
    public boolean forceReprocess(UUID documentId) {
        Document document = findDocument(documentId);
        return enqueue(document.id(), document.title(), true);
    }

    @Override
    public QueueStats stats() {
        return queueRepository.stats();
    }

    @Override
    public int resetFailed() {
        int reset = queueRepository.resetFailed();
        log.info("Reset {} failed queue items to pending", reset);
        return reset;
    }

    @Override
    public int cleanupCompleted(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new WrongQueryException("older_than_days must not be negative, got " + olderThanDays);
        }
        int deleted = queueRepository.deleteCompletedOlderThan(olderThanDays);
        log.info("Deleted {} completed queue items older than {} days", deleted, olderThanDays);
        return deleted;
    }

    @Override
    public int backfillUnprocessed() {
        List<Document> candidates = documentRepository.findUnprocessed(sampleChars);
        log.info("Backfill: {} documents without insights or queue entries", candidates.size());

        int queued = 0;
        for (Document document : candidates) {
            if (classifier.classify(document.title(), document.content()) && enqueue(document.id(), document.title())) {
                queued++;
            }
        }

        log.info("Backfill queued {} of {} documents", queued, candidates.size());
        return queued;
    }

    @Override
    public List<QueueMonitorEntry> findRecent(int limit) {
        if (limit < 1 || limit > MAX_MONITOR_ROWS) {
            throw new WrongQueryException("Limit must be between 1 and " + MAX_MONITOR_ROWS + ", got " + limit);
        }
        return queueRepository.findRecent(limit);
    }

    private boolean enqueue(UUID documentId, String title, boolean force) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("queued_at", OffsetDateTime.now(ZoneOffset.UTC).toString());
        if (force) {
            metadata.put(ProcessingQueueItem.FORCE_REPROCESS, true);
        }

        boolean queued = queueRepository.enqueue(documentId, title, metadata, !force);
        if (queued) {
            log.info("Queued doc {} for insight extraction{}", documentId, force ? " (forced)" : "");
            eventPublisher.publishEvent(new InsightsQueuedEvent(documentId));
        } else {
            log.debug("Doc {} not queued: already queued or already has insights", documentId);
        }
        return queued;
    }

    private Document findDocument(UUID documentId) {
        return documentRepository.findById(documentId)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", documentId);
                return new EntityNotFoundException("Document", documentId);
            });
    }

    private String sample(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > sampleChars ? content.substring(0, sampleChars) : content;
    }
}
