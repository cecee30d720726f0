package com.lpzapper.ledger;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * An open liquidity position, one per token. {@code initialBaseValue} is the ETH put in across all entries and
 * {@code initialMarketCap} the ETH-weighted average market cap (in ETH) at entry. {@code timestamp} is epoch millis
 * of the last entry.
 */
public record Position(
        String tokenAddress,
        String pairAddress,
        @JsonProperty("initialEthValue") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal initialBaseValue,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal initialMarketCap,
        long timestamp
) {

    static final int SCALE = 18;

    /**
     * Folds another entry into this position:
     * {@code cap = (oldCap·oldBase + cap·base) / (oldBase + base)}, {@code base = oldBase + base}.
     */
    public Position merge(String pair, BigDecimal baseAmount, BigDecimal marketCap, long now) {
        BigDecimal totalBase = initialBaseValue.add(baseAmount);
        BigDecimal cap;
        if (totalBase.signum() == 0) {
            cap = marketCap;
        } else {
            cap = initialMarketCap.multiply(initialBaseValue)
                    .add(marketCap.multiply(baseAmount))
                    .divide(totalBase, SCALE, RoundingMode.HALF_UP)
                    .stripTrailingZeros();
        }
        return new Position(tokenAddress, pair != null ? pair : pairAddress, totalBase, cap, now);
    }
}
