package com.bridgewatcher.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 30_000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_doublesEachAttempt() {
        RetryPolicy policy = new RetryPolicy(100L, 10_000L, 0, 5); // no jitter for deterministic test
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
        assertThat(policy.delayMs(3)).isEqualTo(800L);
    }

    @Test
    void delayMs_cappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 5000L, 0, 10);
        assertThat(policy.delayMs(3)).isEqualTo(5000L);
        assertThat(policy.delayMs(40)).isEqualTo(5000L);
    }

    @Test
    void defaultPolicy_matchesDocumentedBackoff() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        assertThat(policy.getMaxAttempts()).isEqualTo(5);
        assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
    }

    @Test
    void noDelay_neverSleeps() {
        RetryPolicy policy = RetryPolicy.noDelay(3);
        assertThat(policy.delayMs(0)).isZero();
        assertThat(policy.delayMs(5)).isZero();
        assertThat(policy.getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void zeroAttempts_rejected() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 100L, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
