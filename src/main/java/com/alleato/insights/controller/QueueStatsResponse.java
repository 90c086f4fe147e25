package com.alleato.insights.controller;

import com.alleato.insights.model.QueueStats;
import com.fasterxml.jackson.annotation.JsonProperty;

public record QueueStatsResponse(
    long pending,
    long processing,
    long completed,
    long failed,
    long total,
    @JsonProperty("oldest_pending_seconds") long oldestPendingSeconds
) {

    static QueueStatsResponse from(QueueStats stats) {
        return new QueueStatsResponse(
            stats.pending(),
            stats.processing(),
            stats.completed(),
            stats.failed(),
            stats.total(),
            stats.oldestPendingAge().toSeconds()
        );
    }
}
