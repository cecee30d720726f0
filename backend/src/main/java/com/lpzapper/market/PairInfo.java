package com.lpzapper.market;

import com.lpzapper.chain.PairReserves;

import java.math.BigDecimal;

/**
 * Pool state of a token's WETH pair. {@code priceEth} is ETH per whole token; {@code marketCapEth} is
 * reserveWETH × tokenTotalSupply / reserveToken. Both are zero for an empty pool.
 */
public record PairInfo(String pairAddress, BigDecimal priceEth, BigDecimal marketCapEth, PairReserves reserves) {
}
