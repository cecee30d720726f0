package com.lpzapper.zap;

import com.lpzapper.chain.PairReserves;
import com.lpzapper.slippage.SlippageEngine;
import com.lpzapper.slippage.SlippagePolicy;

import java.math.BigInteger;

/**
 * Minimum amounts for removing {@code liquidity} from a WETH pair and swapping the token side back to WETH.
 * <p>
 * The burn returns the pro-rata share of each reserve; the token share is then sold into the pool that is left,
 * and the tolerance is derived from the impact of that sale.
 */
record ZapOutBounds(int toleranceBps, BigInteger amountAMin, BigInteger amountBMin, BigInteger amountOutMin) {

    static ZapOutBounds of(PairReserves reserves, BigInteger liquidity, SlippageEngine engine) {
        if (reserves.lpTotalSupply().signum() == 0) {
            return new ZapOutBounds(engine.evaluate(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO).toleranceBps(),
                    BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
        }
        BigInteger baseShare = reserves.reserveBase().multiply(liquidity).divide(reserves.lpTotalSupply());
        BigInteger tokenShare = reserves.reserveToken().multiply(liquidity).divide(reserves.lpTotalSupply());
        BigInteger baseLeft = reserves.reserveBase().subtract(baseShare);
        BigInteger tokenLeft = reserves.reserveToken().subtract(tokenShare);

        SlippagePolicy policy = engine.evaluate(tokenShare, tokenLeft, baseLeft);
        int bps = policy.toleranceBps();
        BigInteger swapOut = SlippageEngine.computeAmountOut(tokenShare, tokenLeft, baseLeft);
        return new ZapOutBounds(bps,
                SlippageEngine.minAmountOut(baseShare, bps),
                SlippageEngine.minAmountOut(tokenShare, bps),
                SlippageEngine.minAmountOut(baseShare.add(swapOut), bps));
    }
}
