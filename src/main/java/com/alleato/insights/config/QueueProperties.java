package com.alleato.insights.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry cap, stale-claim timeout and retention window of the processing queue.
 */
@Validated
@ConfigurationProperties(prefix = "app.queue")
public record QueueProperties(
    @NotNull @Min(1) @Max(20) Integer maxRetries,
    @NotNull @Min(1) Integer staleThresholdMinutes,
    @NotNull @Min(0) Integer retentionDays
) {

    public QueueProperties {
        if (maxRetries == null) {
            maxRetries = 3;
        }
        if (staleThresholdMinutes == null) {
            staleThresholdMinutes = 30;
        }
        if (retentionDays == null) {
            retentionDays = 7;
        }
    }
}
