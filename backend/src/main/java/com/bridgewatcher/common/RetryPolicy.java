package com.bridgewatcher.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter and a delay ceiling. Used by the attestation sink between delivery attempts.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds after the given zero-based failed attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ±jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0 || value == 0L) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, factor 2, 30s ceiling, ±20% jitter, 5 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 30_000L, 0.2, 5);
    }

    /**
     * Retries immediately; for tests and for callers that sleep elsewhere.
     */
    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(0L, 0L, 0.0, maxAttempts);
    }
}
