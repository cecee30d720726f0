package com.lpzapper.common.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached value and the instant it was fetched. Replaced, never mutated, on refetch.
 */
public record CacheEntry<T>(T value, Instant fetchedAt) {

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }

    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }
}
