package com.alleato.insights.worker;

import com.alleato.insights.config.QueueProperties;
import com.alleato.insights.event.InsightsQueuedEvent;
import com.alleato.insights.service.DequeueCoordinator;
import com.alleato.insights.service.ProcessingQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class QueueMaintenanceWorker {

    private final DequeueCoordinator coordinator;
    private final ProcessingQueueService queueService;
    private final QueueProperties queueProperties;
    private final ApplicationEventPublisher eventPublisher;

    @Scheduled(fixedDelayString = "${app.worker.maintenance-interval-ms:60000}")
    public void reclaimStaleItems() {
        log.debug("Starting maintenance: checking for stuck queue items...");

        List<UUID> reclaimed = coordinator.reclaimStale(Duration.ofMinutes(queueProperties.staleThresholdMinutes()));
        if (reclaimed.isEmpty()) {
            return;
        }

        Set<UUID> uniqueDocIds = new LinkedHashSet<>(reclaimed);
        log.info("Maintenance reclaimed {} queue items. Re-triggering processing...", uniqueDocIds.size());
        uniqueDocIds.forEach(docId -> eventPublisher.publishEvent(new InsightsQueuedEvent(docId)));
    }

    @Scheduled(cron = "${app.worker.retention-cron:0 30 3 * * *}")
    public void purgeCompletedItems() {
        int deleted = queueService.cleanupCompleted(queueProperties.retentionDays());
        if (deleted > 0) {
            log.info("Retention removed {} completed queue items", deleted);
        }
    }
}
