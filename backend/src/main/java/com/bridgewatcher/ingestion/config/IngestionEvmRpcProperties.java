package com.bridgewatcher.ingestion.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * EVM RPC throttling for this watcher instance.
 *
 * @param maxRequestsPerSecond  local request budget across all endpoints
 * @param localLimiterTimeoutMs how long a call may wait for a permit before counting as unavailable
 */
@Validated
@ConfigurationProperties(prefix = "bridgewatcher.ledger.rpc")
public record IngestionEvmRpcProperties(
        @DefaultValue("25") @Min(1) int maxRequestsPerSecond,
        @DefaultValue("2000") @Min(0) long localLimiterTimeoutMs
) {
}
