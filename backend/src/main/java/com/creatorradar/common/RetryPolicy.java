package com.creatorradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for outbound retries (queue publish).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the given zero-based retry.
     * baseDelay * 2^attempt, then ±jitterFactor.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    /**
     * True when another attempt is allowed after {@code attemptsMade} attempts.
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    private long jitter(long value) {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 200ms base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(200L, 0.2, 3);
    }
}
