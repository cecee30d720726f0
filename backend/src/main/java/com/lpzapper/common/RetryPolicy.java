package com.lpzapper.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter and an upper bound, used between JSON-RPC retries.
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
     * Delay before the retry that follows the given zero-based failed attempt:
     * {@code min(maxDelay, baseDelay * 2^attempt)} with ±jitter applied.
     */
    public long delayMs(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), 20);
        long exponential = Math.min(maxDelayMs, baseDelayMs * (1L << shift));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0L, (long) (value * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 300ms base, 5s cap, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(300L, 5_000L, 0.2, 3);
    }
}
