package com.lpzapper.chain;

import java.math.BigInteger;

/**
 * Pool reserves oriented so that {@code reserveBase} is always the base asset (WETH) side,
 * whatever the pair's token0/token1 order. {@code lpTotalSupply} is the pair's LP token supply.
 */
public record PairReserves(String pairAddress, BigInteger reserveBase, BigInteger reserveToken, BigInteger lpTotalSupply) {

    public boolean isEmpty() {
        return reserveBase.signum() == 0 || reserveToken.signum() == 0;
    }
}
