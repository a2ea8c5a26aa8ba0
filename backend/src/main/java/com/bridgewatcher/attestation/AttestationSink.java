package com.bridgewatcher.attestation;

import com.bridgewatcher.common.RetryPolicy;
import com.bridgewatcher.domain.DeliveryOutcome;
import com.bridgewatcher.domain.EventRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * Delivers records to the attestation API.
 *
 * <ul>
 *   <li>2xx: delivered; the nonce is remembered so a re-scanned batch does not post it again</li>
 *   <li>4xx other than 408/429: rejected permanently, no retry</li>
 *   <li>5xx, 408, 429, transport failure: retried with exponential backoff; when attempts run out the outcome
 *       is a retryable failure and the caller keeps the batch for the next poll</li>
 * </ul>
 * Called from the single watcher thread only.
 */
@Slf4j
@Component
public class AttestationSink {

    public static final String DELIVERED_NONCE_CACHE = "deliveredNonceCache";
    private static final int MAX_BODY_IN_REASON = 200;

    private final AttestationApiClient apiClient;
    private final RetryPolicy retryPolicy;
    private final Cache deliveredNonces;

    public AttestationSink(AttestationApiClient apiClient,
                           @Qualifier("attestationRetryPolicy") RetryPolicy retryPolicy,
                           CacheManager cacheManager) {
        this.apiClient = apiClient;
        this.retryPolicy = retryPolicy;
        this.deliveredNonces = Objects.requireNonNull(cacheManager.getCache(DELIVERED_NONCE_CACHE),
                "Cache " + DELIVERED_NONCE_CACHE + " is not configured");
    }

    public DeliveryOutcome submit(EventRecord record) {
        if (deliveredNonces.get(record.nonce()) != null) {
            log.info("Nonce {} already attested by this node (tx={}), not posting again",
                    record.nonce(), record.transactionHash());
            return DeliveryOutcome.alreadyDelivered();
        }
        AttestationPayload payload = AttestationPayload.from(record);
        int maxAttempts = retryPolicy.getMaxAttempts();
        String lastReason = "no attempt made";
        Integer lastStatus = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                try {
                    Thread.sleep(retryPolicy.delayMs(attempt - 2));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Backoff interrupted for nonce {} (tx={}) after {} attempt(s)",
                            record.nonce(), record.transactionHash(), attempt - 1);
                    return DeliveryOutcome.retryableFailure("interrupted: " + lastReason, attempt - 1, lastStatus);
                }
            }
            try {
                AttestationResponse response = apiClient.post(payload);
                lastStatus = response.statusCode();
                if (response.isSuccess()) {
                    deliveredNonces.put(record.nonce(), Instant.now());
                    log.info("Attestation delivered: nonce={} tx={} block={} attempt={} http={}",
                            record.nonce(), record.transactionHash(), record.blockNumber(), attempt, lastStatus);
                    return DeliveryOutcome.delivered(attempt, lastStatus);
                }
                lastReason = "HTTP " + lastStatus + abbreviate(response.body());
                if (!response.isRetryable()) {
                    log.warn("Attestation rejected: nonce={} tx={} attempt={} {}",
                            record.nonce(), record.transactionHash(), attempt, lastReason);
                    return DeliveryOutcome.rejectedPermanently(lastReason, attempt, lastStatus);
                }
                log.warn("Attestation attempt {}/{} failed: nonce={} tx={} {}",
                        attempt, maxAttempts, record.nonce(), record.transactionHash(), lastReason);
            } catch (AttestationTransportException e) {
                lastStatus = null;
                lastReason = e.getMessage();
                log.warn("Attestation attempt {}/{} failed: nonce={} tx={} {}",
                        attempt, maxAttempts, record.nonce(), record.transactionHash(), lastReason);
            }
        }
        log.warn("Attestation unavailable after {} attempts: nonce={} tx={} last={}",
                maxAttempts, record.nonce(), record.transactionHash(), lastReason);
        return DeliveryOutcome.retryableFailure(lastReason, maxAttempts, lastStatus);
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_BODY_IN_REASON ? trimmed.substring(0, MAX_BODY_IN_REASON) + "..." : trimmed);
    }
}
