package com.rms.relay.core.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

    @Test
    @DisplayName("backoff doubles from the initial value and is capped at the max")
    void exponentialWithCap() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);

        assertThat(policy.backoff(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoff(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(policy.backoff(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoff(10_000)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("backoff is non-decreasing and never exceeds the max")
    void monotonicAndBounded() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(150), Duration.ofSeconds(7), 1.7);

        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 200; attempt++) {
            Duration wait = policy.backoff(attempt);
            assertThat(wait).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(Duration.ofSeconds(7));
            previous = wait;
        }
    }

    @Test
    @DisplayName("multiplier 1 gives a constant backoff")
    void constantBackoff() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(5), 1.0);

        assertThat(policy.backoff(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoff(9)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("invalid settings are rejected at construction")
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeAttempt() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);

        assertThatThrownBy(() -> policy.backoff(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
