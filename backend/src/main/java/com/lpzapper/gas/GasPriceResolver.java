package com.lpzapper.gas;

import com.lpzapper.common.cache.TtlCache;
import com.lpzapper.gas.config.GasProperties;
import com.lpzapper.gas.strategy.StaticDefaultStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Chain: primary oracle → node fee data → static default. Each network tier is memoized in the
 * {@link TtlCache} under {@code gas:<source>}, so a failing tier still answers with its last good quote
 * while one exists. {@link #resolve()} never fails.
 */
@Component
@Slf4j
public class GasPriceResolver {

    static final String CACHE_KEY_PREFIX = "gas:";

    private final List<GasQuoteStrategy> strategies;
    private final GasQuoteStrategy staticDefault;
    private final TtlCache ttlCache;
    private final GasProperties gasProperties;

    @Autowired
    public GasPriceResolver(List<GasQuoteStrategy> strategies, TtlCache ttlCache, GasProperties gasProperties) {
        this(strategies, new StaticDefaultStrategy(gasProperties), ttlCache, gasProperties);
    }

    GasPriceResolver(List<GasQuoteStrategy> strategies, GasQuoteStrategy staticDefault,
                     TtlCache ttlCache, GasProperties gasProperties) {
        this.strategies = List.copyOf(strategies);
        this.staticDefault = staticDefault;
        this.ttlCache = ttlCache;
        this.gasProperties = gasProperties;
    }

    public GasQuote resolve() {
        Duration ttl = Duration.ofMillis(gasProperties.getQuoteTtlMs());
        for (GasQuoteStrategy strategy : strategies) {
            GasQuoteResult result = attemptCached(strategy, ttl);
            if (result.isSuccess()) {
                GasQuote quote = result.orElseThrow();
                logQuote(quote);
                return quote;
            }
            log.warn("Gas tier {} failed: {}", strategy.source(), result.getReason());
        }
        GasQuote fallback = staticDefault.attempt().orElseThrow();
        logQuote(fallback);
        return fallback;
    }

    private GasQuoteResult attemptCached(GasQuoteStrategy strategy, Duration ttl) {
        try {
            GasQuote quote = ttlCache.getOrFetch(CACHE_KEY_PREFIX + strategy.source(), ttl,
                    () -> strategy.attempt().orElseThrow());
            return GasQuoteResult.success(quote);
        } catch (RuntimeException e) {
            return GasQuoteResult.failure(e.getMessage(), e);
        }
    }

    private static void logQuote(GasQuote quote) {
        log.info("Gas quote from {} ({}): maxFee={} wei, priorityFee={} wei, baseFee={} wei",
                quote.source(), quote.speedTier(), quote.maxFee(), quote.priorityFee(), quote.baseFee());
    }
}
