package com.alleato.insights.controller;

import com.alleato.insights.config.QueueProperties;
import com.alleato.insights.service.ProcessingQueueService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/queue")
@RequiredArgsConstructor
public class QueueController {

    private final ProcessingQueueService queueService;
    private final QueueProperties queueProperties;

    @GetMapping("/stats")
    public ResponseEntity<QueueStatsResponse> stats() {
        return ResponseEntity.ok(QueueStatsResponse.from(queueService.stats()));
    }

    @GetMapping("/items")
    public ResponseEntity<List<QueueItemResponse>> recentItems(
        @RequestParam(name = "limit", defaultValue = "50") int limit) {

        return ResponseEntity.ok(queueService.findRecent(limit).stream()
            .map(QueueItemResponse::from)
            .toList());
    }

    @PostMapping("/reset-failed")
    public ResponseEntity<CountResponse> resetFailed() {
        return ResponseEntity.ok(new CountResponse("reset_failed", queueService.resetFailed()));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<CountResponse> cleanup(
        @RequestParam(name = "older_than_days", required = false) Integer olderThanDays) {

        int days = olderThanDays != null ? olderThanDays : queueProperties.retentionDays();
        return ResponseEntity.ok(new CountResponse("cleanup", queueService.cleanupCompleted(days)));
    }

    @PostMapping("/backfill")
    public ResponseEntity<CountResponse> backfill() {
        return ResponseEntity.ok(new CountResponse("backfill", queueService.backfillUnprocessed()));
    }
}
