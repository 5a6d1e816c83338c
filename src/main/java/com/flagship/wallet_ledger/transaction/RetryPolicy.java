package com.flagship.wallet_ledger.transaction;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential backoff for optimistic conflicts.
 *
 * The delay after attempt {@code n} is {@code initialBackoff * 2^(n-1)}, plus up to
 * {@code jitter * delay} of random extra wait when jitter is positive.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double jitter;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double jitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("Initial backoff must be zero or positive");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("Jitter must be between 0.0 and 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.jitter = jitter;
    }

    /**
     * Three attempts, 100ms doubling, no jitter.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), 0.0);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attempt the 1-based attempt that just failed
     * @return how long to wait before the next attempt
     */
    public Duration backoffAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1");
        }
        long base = initialBackoff.toMillis() << Math.min(attempt - 1, 20);
        if (jitter == 0.0 || base == 0) {
            return Duration.ofMillis(base);
        }
        long extra = (long) (ThreadLocalRandom.current().nextDouble() * jitter * base);
        return Duration.ofMillis(base + extra);
    }
}
