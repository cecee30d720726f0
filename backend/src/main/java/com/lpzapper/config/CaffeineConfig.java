package com.lpzapper.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.lpzapper.common.cache.TtlCache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches: the stale-tolerant {@link TtlCache} for gas quotes, gas estimates and prices,
 * and the Spring-managed token metadata cache.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String TOKEN_META_CACHE = "tokenMetaCache";

    /** Upper bound on TtlCache keys (gas tiers, gas estimates per call, ETH/USD). */
    static final long TTL_CACHE_MAX_ENTRIES = 2_000;

    /** Upper bound on live sessions per per-session cache. */
    static final long SESSION_CACHE_MAX_ENTRIES = 10_000;

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TOKEN_META_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }

    /** No time-based eviction here: freshness is decided per call so stale values survive for fallback. */
    @Bean
    public TtlCache ttlCache(Clock clock) {
        return new TtlCache(Caffeine.newBuilder()
                .maximumSize(TTL_CACHE_MAX_ENTRIES)
                .build(), clock);
    }

    /**
     * Per-session state keyed by client-chosen session id, dropped after {@code idle} without reads or writes.
     * Time follows {@code clock}; the removal listener runs on the thread that triggered the removal.
     */
    public static <V> Cache<String, V> sessionScoped(Duration idle, Clock clock, RemovalListener<String, V> onRemoval) {
        return Caffeine.newBuilder()
                .expireAfterAccess(idle)
                .maximumSize(SESSION_CACHE_MAX_ENTRIES)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .removalListener(onRemoval)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
