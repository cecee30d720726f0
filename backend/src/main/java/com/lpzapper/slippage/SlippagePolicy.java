package com.lpzapper.slippage;

import java.math.BigDecimal;

/**
 * Tolerance chosen for one trade together with the price impact it was derived from (percent).
 */
public record SlippagePolicy(int toleranceBps, BigDecimal priceImpactPct) {
}
