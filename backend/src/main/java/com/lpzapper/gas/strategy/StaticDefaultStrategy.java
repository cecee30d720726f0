package com.lpzapper.gas.strategy;

import com.lpzapper.common.EthUnits;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.gas.GasQuoteResult;
import com.lpzapper.gas.GasQuoteSource;
import com.lpzapper.gas.GasQuoteStrategy;
import com.lpzapper.gas.config.GasProperties;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * Terminal tier: configured default max fee with the minimum priority fee. Always succeeds.
 * Held by {@link com.lpzapper.gas.GasPriceResolver} outside the ordered strategy list.
 */
@RequiredArgsConstructor
public class StaticDefaultStrategy implements GasQuoteStrategy {

    private final GasProperties gasProperties;

    @Override
    public GasQuoteSource source() {
        return GasQuoteSource.STATIC_DEFAULT;
    }

    @Override
    public GasQuoteResult attempt() {
        BigInteger maxFee = EthUnits.gweiToWei(gasProperties.getStaticDefaultMaxFeeGwei());
        BigInteger priority = EthUnits.gweiToWei(gasProperties.getMinPriorityFeeGwei());
        return GasQuoteResult.success(GasQuote.capped(BigInteger.ZERO, priority, maxFee,
                EthUnits.gweiToWei(gasProperties.getCeilingGwei()), gasProperties.getSpeedTier(), GasQuoteSource.STATIC_DEFAULT));
    }
}
