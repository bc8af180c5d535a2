package com.launchradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        BackoffPolicy policy = new BackoffPolicy(1000L, 30_000L, 20, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    @DisplayName("socket reconnect delay is min(2000 * 2^n, 60000)")
    void socketReconnect_delays() {
        BackoffPolicy policy = BackoffPolicy.socketReconnect();
        long[] expected = {2_000, 4_000, 8_000, 16_000, 32_000, 60_000, 60_000, 60_000, 60_000, 60_000};
        for (int n = 0; n < expected.length; n++) {
            assertThat(policy.delayMs(n)).as("attempt %d", n).isEqualTo(expected[n]);
        }
    }

    @Test
    @DisplayName("socket reconnect allows attempts 0..9 only")
    void socketReconnect_boundedAttempts() {
        BackoffPolicy policy = BackoffPolicy.socketReconnect();
        assertThat(policy.allowsAttempt(0)).isTrue();
        assertThat(policy.allowsAttempt(9)).isTrue();
        assertThat(policy.allowsAttempt(10)).isFalse();
    }

    @Test
    @DisplayName("rate-limit cool-down is min(180000 * 2^min(c, 6), 3600000)")
    void connectionRateLimit_delays() {
        BackoffPolicy policy = BackoffPolicy.connectionRateLimit();
        assertThat(policy.delayMs(0)).isEqualTo(180_000L);
        assertThat(policy.delayMs(1)).isEqualTo(360_000L);
        assertThat(policy.delayMs(4)).isEqualTo(2_880_000L);
        assertThat(policy.delayMs(5)).isEqualTo(3_600_000L);
        assertThat(policy.delayMs(6)).isEqualTo(3_600_000L);
        assertThat(policy.delayMs(40)).isEqualTo(3_600_000L);
    }

    @Test
    void rpcRetry_hasThreeAttempts() {
        assertThat(BackoffPolicy.rpcRetry().getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void constructor_maxBelowBase_throws() {
        assertThatThrownBy(() -> new BackoffPolicy(1000L, 10L, 5, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
