package com.lpzapper.market;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.chain.PairReserves;
import com.lpzapper.common.cache.TtlCache;
import com.lpzapper.market.config.MarketProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * ETH/USD spot from the WETH/USD-stablecoin pool reserves. Display only: returns zero when no price can be had.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EthUsdPriceResolver {

    static final String CACHE_KEY = "eth-usd";
    private static final int SCALE = 6;

    private final ChainGateway chainGateway;
    private final MarketProperties marketProperties;
    private final TtlCache ttlCache;

    public BigDecimal getEthUsd() {
        try {
            return ttlCache.getOrFetch(CACHE_KEY, Duration.ofMillis(marketProperties.getEthUsdTtlMs()), this::fetch);
        } catch (RuntimeException e) {
            log.warn("ETH/USD price unavailable: {}", e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    private BigDecimal fetch() {
        String weth = marketProperties.getWethAddress();
        String usd = marketProperties.getUsdAddress();
        String pair = chainGateway.getPair(marketProperties.getFactoryAddress(), weth, usd)
                .orElseThrow(() -> new PairNotFoundException(usd));
        PairReserves reserves = chainGateway.getReserves(pair, weth);
        if (reserves.isEmpty()) {
            throw new IllegalStateException("WETH/USD pool " + pair + " has no liquidity");
        }
        BigDecimal ethReserve = new BigDecimal(reserves.reserveBase()).movePointLeft(18);
        BigDecimal usdReserve = new BigDecimal(reserves.reserveToken()).movePointLeft(marketProperties.getUsdDecimals());
        return usdReserve.divide(ethReserve, SCALE, RoundingMode.HALF_UP);
    }
}
