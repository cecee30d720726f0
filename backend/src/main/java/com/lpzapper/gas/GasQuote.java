package com.lpzapper.gas;

import java.math.BigInteger;
import java.util.Objects;

/**
 * EIP-1559 fee quote in wei. A quote with {@code priorityFee > maxFee} cannot be constructed.
 */
public record GasQuote(
        BigInteger baseFee,
        BigInteger priorityFee,
        BigInteger maxFee,
        SpeedTier speedTier,
        GasQuoteSource source
) {

    public GasQuote {
        Objects.requireNonNull(baseFee, "baseFee");
        Objects.requireNonNull(priorityFee, "priorityFee");
        Objects.requireNonNull(maxFee, "maxFee");
        Objects.requireNonNull(speedTier, "speedTier");
        Objects.requireNonNull(source, "source");
        if (baseFee.signum() < 0 || priorityFee.signum() < 0 || maxFee.signum() < 0) {
            throw new IllegalArgumentException("Fees must be non-negative");
        }
        if (priorityFee.compareTo(maxFee) > 0) {
            throw new IllegalArgumentException("priorityFee " + priorityFee + " exceeds maxFee " + maxFee);
        }
    }

    /**
     * Caps {@code maxFee} at {@code ceiling} and clamps the priority fee down to the capped max fee.
     */
    public static GasQuote capped(BigInteger baseFee, BigInteger priorityFee, BigInteger maxFee, BigInteger ceiling,
                                  SpeedTier tier, GasQuoteSource source) {
        BigInteger cappedMax = maxFee.min(ceiling);
        return new GasQuote(baseFee, priorityFee.min(cappedMax), cappedMax, tier, source);
    }

    /** Worst-case fee for {@code gasLimit} units: gasLimit × maxFee. */
    public BigInteger feeFor(BigInteger gasLimit) {
        return gasLimit.multiply(maxFee);
    }
}
