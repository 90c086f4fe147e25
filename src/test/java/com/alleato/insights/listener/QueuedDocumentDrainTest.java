package com.alleato.insights.listener;

import com.alleato.insights.classifier.TranscriptClassifier;
import com.alleato.insights.config.AsyncConfig;
import com.alleato.insights.model.Document;
import com.alleato.insights.repository.DocumentRepository;
import com.alleato.insights.repository.ProcessingQueueRepository;
import com.alleato.insights.service.ProcessingQueueService;
import com.alleato.insights.service.ProcessingQueueServiceImpl;
import com.alleato.insights.worker.InsightWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Wires the real executor, listener and queue service so that queue wake-ups go through
 * the same thread pool as in the running service.
 */
@SpringJUnitConfig(classes = {
    AsyncConfig.class,
    DocumentEventListener.class,
    ProcessingQueueServiceImpl.class,
    TranscriptClassifier.class
})
@TestPropertySource(properties = "app.worker.concurrency=2")
class QueuedDocumentDrainTest {

    private static final int DOCUMENTS = 150;

    @Autowired
    private ProcessingQueueService queueService;

    @MockitoBean
    private ProcessingQueueRepository queueRepository;

    @MockitoBean
    private DocumentRepository documentRepository;

    @MockitoBean
    private InsightWorker insightWorker;

    @Test
    @DisplayName("Backfilling many transcripts while the worker is busy should queue all of them")
    void backfillShouldSurviveBusyWorkers() throws Exception {
        List<Document> transcripts = IntStream.range(0, DOCUMENTS)
            .mapToObj(i -> new Document(
                UUID.randomUUID(), "Weekly Sync " + i, "Alice: status update", "fireflies",
                Document.CATEGORY_MEETING, null, null, List.of("Alice"), null, Map.of(), null, null))
            .toList();
        when(documentRepository.findUnprocessed(2000)).thenReturn(transcripts);
        when(queueRepository.enqueue(any(UUID.class), anyString(), anyMap(), anyBoolean())).thenReturn(true);

        CountDownLatch release = new CountDownLatch(1);
        when(insightWorker.drain()).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return 0;
        });

        try {
            int queued = queueService.backfillUnprocessed();

            assertThat(queued).isEqualTo(DOCUMENTS);
            verify(queueRepository, times(DOCUMENTS)).enqueue(any(UUID.class), anyString(), anyMap(), anyBoolean());
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(insightWorker).drain());
        } finally {
            release.countDown();
        }

        // One blocked pass plus at most one follow-up for everything queued meanwhile
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(insightWorker, atMost(2)).drain());
        verify(insightWorker, atLeastOnce()).drain();
    }
}
