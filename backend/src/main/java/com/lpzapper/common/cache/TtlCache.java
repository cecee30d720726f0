package com.lpzapper.common.cache;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Memoized fetch with stale-on-error fallback.
 * <p>
 * A value younger than the caller's TTL is returned without I/O. Otherwise the fetcher runs: a success
 * replaces the entry, a failure returns the previous (stale) value if there is one and propagates
 * otherwise. Refresh is lazy and caller-triggered only. Entries are kept in a size-bounded Caffeine
 * cache without time-based eviction so stale values stay available for the fallback.
 */
@Slf4j
public class TtlCache {

    private final Cache<String, CacheEntry<Object>> entries;
    private final Clock clock;

    public TtlCache(Cache<String, CacheEntry<Object>> entries, Clock clock) {
        this.entries = entries;
        this.clock = clock;
    }

    public <T> T getOrFetch(String key, Duration ttl, Fetcher<T> fetcher) {
        return getOrFetch(key, ttl, fetcher, true);
    }

    /**
     * With {@code serveStale} false a failed refresh drops the expired entry and propagates, for values where
     * an old answer would hide a real error.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrFetch(String key, Duration ttl, Fetcher<T> fetcher, boolean serveStale) {
        Instant now = clock.instant();
        CacheEntry<Object> existing = entries.getIfPresent(key);
        if (existing != null && existing.isFresh(now, ttl)) {
            return (T) existing.value();
        }
        log.debug("Cache {} for {}", existing == null ? "miss" : "expired", key);

        T value;
        try {
            value = fetcher.fetch();
        } catch (Exception e) {
            if (existing != null && serveStale) {
                log.warn("Refresh of {} failed, serving stale value aged {}ms: {}",
                        key, existing.age(now).toMillis(), messageOf(e));
                return (T) existing.value();
            }
            if (existing != null) {
                entries.invalidate(key);
            }
            log.warn("Fetch of {} failed with no usable cached value: {}", key, messageOf(e));
            if (e instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CacheFetchException("Fetch of " + key + " failed", e);
        }
        entries.put(key, new CacheEntry<>(value, clock.instant()));
        return value;
    }

    public Optional<CacheEntry<Object>> peek(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    public void invalidate(String key) {
        entries.invalidate(key);
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
