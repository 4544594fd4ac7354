package com.talentledger.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayDoublesPerAttemptUpToCeiling() {
        RetryPolicy policy = new RetryPolicy(100, 1_000, 0.0, 5);

        assertThat(policy.delayMs(0)).isEqualTo(100);
        assertThat(policy.delayMs(1)).isEqualTo(200);
        assertThat(policy.delayMs(3)).isEqualTo(800);
        assertThat(policy.delayMs(4)).isEqualTo(1_000);
        assertThat(policy.delayMs(40)).isEqualTo(1_000);
    }

    @Test
    void jitterStaysWithinFactor() {
        RetryPolicy policy = new RetryPolicy(1_000, 1_000, 0.2, 5);
        for (int i = 0; i < 200; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1_200L);
        }
    }

    @Test
    void exhaustedAfterMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(10, 10, 0.0, 3);

        assertThat(policy.isExhausted(2)).isFalse();
        assertThat(policy.isExhausted(3)).isTrue();
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(10, 10, 0.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
