package com.example.paperdigest.model;

import java.time.Duration;
import java.util.Random;

/**
 * Bounded exponential backoff with additive jitter.
 *
 * @param maxAttempts Total attempts including the first one (at least 1)
 * @param baseDelay   Delay before the second attempt
 * @param maxDelay    Upper bound on the exponential part
 * @param jitter      Upper bound on the random part added to each delay
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        Duration jitter
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
        maxDelay = maxDelay != null ? maxDelay : baseDelay;
        jitter = jitter != null ? jitter : Duration.ZERO;
    }

    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration delayAfter(int attempt, Random random) {
        long base = baseDelay.toMillis();
        long exp = base <= 0 ? 0 : base << Math.min(Math.max(attempt - 1, 0), 20);
        long capped = Math.min(exp, Math.max(maxDelay.toMillis(), base));
        long jitterMs = jitter.toMillis() > 0 ? (long) (random.nextDouble() * jitter.toMillis()) : 0L;
        return Duration.ofMillis(capped + jitterMs);
    }
}
