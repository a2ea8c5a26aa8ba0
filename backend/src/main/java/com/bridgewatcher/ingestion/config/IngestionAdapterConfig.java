package com.bridgewatcher.ingestion.config;

import com.bridgewatcher.common.AddressFormat;
import com.bridgewatcher.ingestion.adapter.EventSelector;
import com.bridgewatcher.ingestion.adapter.LedgerClient;
import com.bridgewatcher.ingestion.adapter.RpcEndpointRotator;
import com.bridgewatcher.ingestion.adapter.evm.EvmLedgerClient;
import com.bridgewatcher.ingestion.adapter.evm.EvmRpcClient;
import com.bridgewatcher.ingestion.adapter.evm.WebClientEvmRpcClient;
import com.bridgewatcher.ingestion.decode.EventSignature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the EVM ledger client from {@link LedgerProperties}: endpoint rotator, rate limiter, event selector.
 */
@Configuration
@EnableConfigurationProperties({ LedgerProperties.class, IngestionEvmRpcProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RpcEndpointRotator ledgerRpcEndpointRotator(LedgerProperties properties) {
        return new RpcEndpointRotator(properties.rpcUrls());
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, LedgerProperties properties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(properties.requestTimeoutMs()));
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(IngestionEvmRpcProperties evmRpcProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, evmRpcProperties.maxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.localLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public LedgerClient ledgerClient(EvmRpcClient evmRpcClient, RpcEndpointRotator ledgerRpcEndpointRotator,
                                     RateLimiter evmRpcRateLimiter, ObjectMapper objectMapper) {
        return new EvmLedgerClient(evmRpcClient, ledgerRpcEndpointRotator, evmRpcRateLimiter, objectMapper);
    }

    @Bean
    public EventSelector bridgeEventSelector(LedgerProperties properties) {
        String signature = properties.eventSignature().replace(" ", "");
        return new EventSelector(AddressFormat.normalize(properties.contractAddress()),
                EventSignature.topicOf(signature), signature);
    }
}
