package com.alleato.insights.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * A queue row with how long it has been waiting or running, and how many insights its
 * document already has.
 */
public record QueueMonitorEntry(
    ProcessingQueueItem item,
    @JsonProperty("processing_time") Duration processingTime,
    @JsonProperty("existing_insights_count") long existingInsightsCount
) {}
