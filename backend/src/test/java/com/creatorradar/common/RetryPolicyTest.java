package com.creatorradar.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(200L, 0, 3);
        assertThat(policy.delayMs(0)).isEqualTo(200L);
        assertThat(policy.delayMs(1)).isEqualTo(400L);
        assertThat(policy.delayMs(2)).isEqualTo(800L);
    }

    @Test
    void canRetry_stopsAtMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(10L, 0, 3);
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(3);
    }
}
