package com.lpzapper.slippage;

import com.lpzapper.slippage.config.SlippageProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Price-impact based slippage tolerance for a constant-product pool with a 0.3% fee.
 * <p>
 * The tolerance grows in bands with the impact of the trade on the pool price:
 * <ul>
 *     <li>impact &lt; 0.5% → min (50 bps by default)</li>
 *     <li>[0.5%, 2%) → 100 bps</li>
 *     <li>[2%, 5%) → 200 bps</li>
 *     <li>[5%, 10%) → 500 bps</li>
 *     <li>≥ 10% → ceil(impact × 100), at most max</li>
 * </ul>
 * The result is always held within [min, max]. All computations are pure.
 */
@Component
@RequiredArgsConstructor
public class SlippageEngine {

    static final int BPS_DENOMINATOR = 10_000;
    private static final BigInteger FEE_NUMERATOR = BigInteger.valueOf(997);
    private static final BigInteger FEE_DENOMINATOR = BigInteger.valueOf(1_000);
    private static final MathContext MC = new MathContext(34, RoundingMode.HALF_EVEN);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SlippageProperties properties;

    /**
     * Output of a swap of {@code amountIn} against the pool: {@code in·997·rOut / (rIn·1000 + in·997)}.
     * Zero when any input is not positive.
     */
    public static BigInteger computeAmountOut(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        if (amountIn.signum() <= 0 || reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger amountInWithFee = amountIn.multiply(FEE_NUMERATOR);
        BigInteger numerator = amountInWithFee.multiply(reserveOut);
        BigInteger denominator = reserveIn.multiply(FEE_DENOMINATOR).add(amountInWithFee);
        return numerator.divide(denominator);
    }

    /**
     * Percentage move of the pool price {@code reserveOut/reserveIn} caused by the trade. Zero for degenerate reserves.
     */
    public static BigDecimal priceImpactPct(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        if (amountIn.signum() <= 0 || reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigInteger out = computeAmountOut(amountIn, reserveIn, reserveOut);
        BigDecimal before = new BigDecimal(reserveOut).divide(new BigDecimal(reserveIn), MC);
        BigDecimal after = new BigDecimal(reserveOut.subtract(out)).divide(new BigDecimal(reserveIn.add(amountIn)), MC);
        return after.subtract(before).abs().divide(before, MC).multiply(HUNDRED, MC);
    }

    /**
     * {@code projected × (10000 − bps) / 10000}, rounded down.
     */
    public static BigInteger minAmountOut(BigInteger projected, int toleranceBps) {
        if (toleranceBps < 0 || toleranceBps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("toleranceBps out of range: " + toleranceBps);
        }
        return projected.multiply(BigInteger.valueOf(BPS_DENOMINATOR - toleranceBps))
                .divide(BigInteger.valueOf(BPS_DENOMINATOR));
    }

    /** Tolerance using the configured dynamic/static switch. */
    public int computeSlippageBps(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        return computeSlippageBps(amountIn, reserveIn, reserveOut, properties.isDynamicEnabled());
    }

    public int computeSlippageBps(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut, boolean enabled) {
        return evaluate(amountIn, reserveIn, reserveOut, enabled).toleranceBps();
    }

    public SlippagePolicy evaluate(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        return evaluate(amountIn, reserveIn, reserveOut, properties.isDynamicEnabled());
    }

    public SlippagePolicy evaluate(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut, boolean enabled) {
        BigDecimal impact = priceImpactPct(amountIn, reserveIn, reserveOut);
        if (!enabled) {
            return new SlippagePolicy(properties.getStaticBps(), impact);
        }
        return new SlippagePolicy(bandFor(impact), impact);
    }

    int bandFor(BigDecimal impactPct) {
        int min = properties.getMinBps();
        int max = properties.getMaxBps();
        int bps;
        if (impactPct.compareTo(new BigDecimal("0.5")) < 0) {
            bps = min;
        } else if (impactPct.compareTo(BigDecimal.valueOf(2)) < 0) {
            bps = 100;
        } else if (impactPct.compareTo(BigDecimal.valueOf(5)) < 0) {
            bps = 200;
        } else if (impactPct.compareTo(BigDecimal.TEN) < 0) {
            bps = 500;
        } else {
            BigDecimal scaled = impactPct.multiply(HUNDRED).setScale(0, RoundingMode.CEILING);
            bps = scaled.compareTo(BigDecimal.valueOf(max)) >= 0 ? max : scaled.intValueExact();
        }
        return Math.max(min, Math.min(max, bps));
    }
}
