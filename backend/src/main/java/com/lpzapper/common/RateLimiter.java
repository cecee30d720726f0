package com.lpzapper.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spacing limiter: hands out at most one permit per {@code period / permits}. Used to keep the
 * gas oracle under its free-tier call budget.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(Long.MIN_VALUE);

    public RateLimiter(int permits, Duration period) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.minIntervalNanos = period.toNanos() / permits;
    }

    /**
     * Takes a permit without waiting. Returns false when the caller should back off.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return (next == Long.MIN_VALUE || now - next >= 0)
                && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }

    /**
     * Blocks until a permit is available.
     */
    public void acquire() {
        while (!tryAcquire()) {
            long waitNanos = Math.max(1_000_000L, nextFreeAtNanos.get() - System.nanoTime());
            try {
                Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Rate limiter interrupted", e);
            }
        }
    }
}
