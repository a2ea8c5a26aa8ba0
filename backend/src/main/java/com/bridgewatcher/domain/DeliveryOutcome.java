package com.bridgewatcher.domain;

import lombok.Getter;

import java.util.Optional;

/**
 * Result of submitting one record to the attestation API: DELIVERED, REJECTED_PERMANENTLY or RETRYABLE_FAILURE.
 */
@Getter
public final class DeliveryOutcome {

    public enum Status {
        DELIVERED,
        REJECTED_PERMANENTLY,
        RETRYABLE_FAILURE
    }

    private final Status status;
    private final String reason;
    private final int attempts;
    /** Last HTTP status received; null when no response came back (transport failure or cached delivery). */
    private final Integer httpStatus;
    /** True when the nonce was already delivered by this process and no request was sent. */
    private final boolean cached;

    private DeliveryOutcome(Status status, String reason, int attempts, Integer httpStatus, boolean cached) {
        this.status = status;
        this.reason = reason;
        this.attempts = attempts;
        this.httpStatus = httpStatus;
        this.cached = cached;
    }

    public static DeliveryOutcome delivered(int attempts, int httpStatus) {
        return new DeliveryOutcome(Status.DELIVERED, null, attempts, httpStatus, false);
    }

    public static DeliveryOutcome alreadyDelivered() {
        return new DeliveryOutcome(Status.DELIVERED, null, 0, null, true);
    }

    public static DeliveryOutcome rejectedPermanently(String reason, int attempts, Integer httpStatus) {
        return new DeliveryOutcome(Status.REJECTED_PERMANENTLY, reason, attempts, httpStatus, false);
    }

    public static DeliveryOutcome retryableFailure(String reason, int attempts, Integer httpStatus) {
        return new DeliveryOutcome(Status.RETRYABLE_FAILURE, reason, attempts, httpStatus, false);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }

    public boolean isRejectedPermanently() {
        return status == Status.REJECTED_PERMANENTLY;
    }

    public boolean isRetryableFailure() {
        return status == Status.RETRYABLE_FAILURE;
    }

    /** Delivered or permanently rejected: nothing more will be attempted for this record in this batch. */
    public boolean isResolved() {
        return status != Status.RETRYABLE_FAILURE;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return status + (reason != null ? "(" + reason + ")" : "") + " attempts=" + attempts
                + (httpStatus != null ? " http=" + httpStatus : "") + (cached ? " cached" : "");
    }
}
