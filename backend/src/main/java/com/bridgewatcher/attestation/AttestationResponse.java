package com.bridgewatcher.attestation;

/**
 * HTTP status and body of one attestation POST.
 */
public record AttestationResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** 408 and 429 are throttling signals, 5xx are server faults; both are worth another attempt. */
    public boolean isRetryable() {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
