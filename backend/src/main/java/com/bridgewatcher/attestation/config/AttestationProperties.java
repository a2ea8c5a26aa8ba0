package com.bridgewatcher.attestation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Destination attestation API settings.
 *
 * @param endpoint            URL the records are POSTed to
 * @param apiKey              sent as a bearer token
 * @param requestTimeoutMs    per-request timeout
 * @param deliveredCacheSize  how many delivered nonces to remember
 * @param deliveredCacheTtlHours how long a delivered nonce is remembered
 * @param retry               backoff between attempts for one record
 */
@Validated
@ConfigurationProperties(prefix = "bridgewatcher.attestation")
public record AttestationProperties(
        @NotBlank @Pattern(regexp = "^https?://\\S+$", message = "must be an http(s) URL") String endpoint,
        @NotBlank String apiKey,
        @DefaultValue("10000") @Min(1) long requestTimeoutMs,
        @DefaultValue("100000") @Min(1) long deliveredCacheSize,
        @DefaultValue("24") @Min(1) long deliveredCacheTtlHours,
        @Valid @DefaultValue Retry retry
) {

    /**
     * Delay after attempt n (zero-based) is min(baseDelayMs * 2^n, maxDelayMs) ± jitter.
     */
    public record Retry(
            @DefaultValue("1000") @Min(0) long baseDelayMs,
            @DefaultValue("30000") @Min(0) long maxDelayMs,
            @DefaultValue("0.2") @DecimalMin("0.0") @DecimalMax("1.0") double jitterFactor,
            @DefaultValue("5") @Min(1) int maxAttempts
    ) {
    }

    @Override
    public String toString() {
        return "AttestationProperties[endpoint=" + endpoint + ", apiKey=***, requestTimeoutMs=" + requestTimeoutMs
                + ", retry=" + retry + "]";
    }
}
