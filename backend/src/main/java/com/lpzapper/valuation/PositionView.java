package com.lpzapper.valuation;

import java.math.BigDecimal;

/**
 * Live display data for one position. ETH amounts are decimal ETH, fees use the zap-out gas assumption.
 */
public record PositionView(
        int index,
        int total,
        String tokenAddress,
        String pairAddress,
        String tokenName,
        String tokenSymbol,
        BigDecimal lpBalance,
        BigDecimal poolSharePct,
        BigDecimal positionValueEth,
        BigDecimal positionValueUsd,
        BigDecimal initialValueEth,
        BigDecimal initialMarketCapEth,
        BigDecimal initialMarketCapUsd,
        BigDecimal currentMarketCapEth,
        BigDecimal currentMarketCapUsd,
        BigDecimal marketCapPnlPct,
        BigDecimal zapOutGasPriceGwei,
        BigDecimal zapOutFeeEth,
        BigDecimal zapOutFeeUsd
) {
}
