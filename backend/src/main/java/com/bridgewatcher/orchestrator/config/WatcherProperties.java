package com.bridgewatcher.orchestrator.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Polling cadence and shutdown budget of the watcher loop.
 *
 * @param pollingIntervalSeconds pause between ticks
 * @param shutdownTimeoutSeconds how long a stop waits for the in-flight batch
 */
@Validated
@ConfigurationProperties(prefix = "bridgewatcher.watcher")
public record WatcherProperties(
        @DefaultValue("15") @Min(1) long pollingIntervalSeconds,
        @DefaultValue("60") @Min(1) long shutdownTimeoutSeconds
) {
}
