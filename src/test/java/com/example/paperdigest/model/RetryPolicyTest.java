package com.example.paperdigest.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayDoublesUntilCapped() {
        RetryPolicy policy = new RetryPolicy(6, Duration.ofMillis(100), Duration.ofMillis(500), Duration.ZERO);
        Random random = new Random(7);

        assertThat(policy.delayAfter(1, random)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayAfter(2, random)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayAfter(3, random)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.delayAfter(4, random)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void jitterStaysBelowItsBound() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(100), Duration.ofMillis(50));
        Random random = new Random(42);

        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayAfter(1, random).toMillis()).isBetween(100L, 149L);
        }
    }

    @Test
    void attemptsAreBoundedByMaxAttempts() {
        RetryPolicy policy = RetryPolicy.noDelay(2);

        assertThat(policy.hasAttemptAfter(1)).isTrue();
        assertThat(policy.hasAttemptAfter(2)).isFalse();
        assertThat(policy.delayAfter(1, new Random())).isEqualTo(Duration.ZERO);
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> RetryPolicy.noDelay(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
