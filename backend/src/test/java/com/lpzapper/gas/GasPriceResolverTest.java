package com.lpzapper.gas;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.lpzapper.common.MutableClock;
import com.lpzapper.common.cache.TtlCache;
import com.lpzapper.gas.config.GasProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GasPriceResolverTest {

    private static final BigInteger GWEI = BigInteger.TEN.pow(9);

    private MutableClock clock;
    private TtlCache ttlCache;
    private GasProperties properties;
    private GasQuoteStrategy oracle;
    private GasQuoteStrategy node;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        ttlCache = new TtlCache(Caffeine.newBuilder().maximumSize(100).build(), clock);
        properties = new GasProperties();
        oracle = mock(GasQuoteStrategy.class);
        node = mock(GasQuoteStrategy.class);
        when(oracle.source()).thenReturn(GasQuoteSource.PRIMARY_ORACLE);
        when(node.source()).thenReturn(GasQuoteSource.NODE_FALLBACK);
    }

    private GasPriceResolver resolver() {
        return new GasPriceResolver(List.of(oracle, node), ttlCache, properties);
    }

    private static GasQuote quote(long maxGwei, GasQuoteSource source) {
        return new GasQuote(GWEI, GWEI, GWEI.multiply(BigInteger.valueOf(maxGwei)), SpeedTier.STANDARD, source);
    }

    @Test
    @DisplayName("oracle quote wins when available")
    void oracleFirst() {
        when(oracle.attempt()).thenReturn(GasQuoteResult.success(quote(30, GasQuoteSource.PRIMARY_ORACLE)));

        GasQuote quote = resolver().resolve();

        assertThat(quote.source()).isEqualTo(GasQuoteSource.PRIMARY_ORACLE);
        verify(node, never()).attempt();
    }

    @Test
    @DisplayName("oracle failure falls through to node fee data")
    void nodeFallback() {
        when(oracle.attempt()).thenReturn(GasQuoteResult.failure("down", null));
        when(node.attempt()).thenReturn(GasQuoteResult.success(quote(25, GasQuoteSource.NODE_FALLBACK)));

        assertThat(resolver().resolve().source()).isEqualTo(GasQuoteSource.NODE_FALLBACK);
    }

    @Test
    @DisplayName("all network tiers failing yields the static default")
    void staticDefault() {
        when(oracle.attempt()).thenReturn(GasQuoteResult.failure("down", null));
        when(node.attempt()).thenReturn(GasQuoteResult.failure("down", null));

        GasQuote quote = resolver().resolve();

        assertThat(quote.source()).isEqualTo(GasQuoteSource.STATIC_DEFAULT);
        assertThat(quote.maxFee()).isEqualTo(GWEI.multiply(BigInteger.TEN));
        assertThat(quote.priorityFee()).isEqualTo(GWEI);
    }

    @Test
    @DisplayName("quotes are reused within the TTL")
    void cachedWithinTtl() {
        when(oracle.attempt()).thenReturn(GasQuoteResult.success(quote(30, GasQuoteSource.PRIMARY_ORACLE)));
        GasPriceResolver resolver = resolver();

        resolver.resolve();
        clock.advance(Duration.ofSeconds(5));
        resolver.resolve();

        verify(oracle, times(1)).attempt();
    }

    @Test
    @DisplayName("a failing oracle still answers with its last good quote")
    void staleOracleQuoteBeatsNode() {
        when(oracle.attempt())
                .thenReturn(GasQuoteResult.success(quote(30, GasQuoteSource.PRIMARY_ORACLE)))
                .thenReturn(GasQuoteResult.failure("rate limited", null));
        GasPriceResolver resolver = resolver();

        resolver.resolve();
        clock.advance(Duration.ofMinutes(1));
        GasQuote second = resolver.resolve();

        assertThat(second.source()).isEqualTo(GasQuoteSource.PRIMARY_ORACLE);
        assertThat(second.maxFee()).isEqualTo(GWEI.multiply(BigInteger.valueOf(30)));
        verify(node, never()).attempt();
    }
}
