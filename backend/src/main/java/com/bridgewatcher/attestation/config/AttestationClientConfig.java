package com.bridgewatcher.attestation.config;

import com.bridgewatcher.attestation.AttestationApiClient;
import com.bridgewatcher.attestation.WebClientAttestationApiClient;
import com.bridgewatcher.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Attestation HTTP client and its retry policy.
 */
@Configuration
@EnableConfigurationProperties(AttestationProperties.class)
public class AttestationClientConfig {

    @Bean(name = "attestationRetryPolicy")
    public RetryPolicy attestationRetryPolicy(AttestationProperties properties) {
        AttestationProperties.Retry retry = properties.retry();
        return new RetryPolicy(retry.baseDelayMs(), retry.maxDelayMs(), retry.jitterFactor(), retry.maxAttempts());
    }

    @Bean
    public AttestationApiClient attestationApiClient(WebClient.Builder webClientBuilder, AttestationProperties properties) {
        return new WebClientAttestationApiClient(webClientBuilder.clone(), properties.endpoint(), properties.apiKey(),
                Duration.ofMillis(properties.requestTimeoutMs()));
    }
}
