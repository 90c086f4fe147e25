package com.alleato.insights.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

public record QueueStats(
    long pending,
    long processing,
    long completed,
    long failed,
    long total,
    @JsonProperty("oldest_pending_age") Duration oldestPendingAge
) {}
