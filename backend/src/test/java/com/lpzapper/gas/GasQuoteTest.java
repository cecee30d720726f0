package com.lpzapper.gas;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GasQuoteTest {

    private static final BigInteger GWEI = BigInteger.TEN.pow(9);

    @Test
    void priorityAboveMaxIsRejected() {
        assertThatThrownBy(() -> new GasQuote(GWEI, GWEI.multiply(BigInteger.TWO), GWEI,
                SpeedTier.STANDARD, GasQuoteSource.PRIMARY_ORACLE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds maxFee");
    }

    @Test
    void cappedClampsMaxAndPriorityToCeiling() {
        BigInteger ceiling = GWEI.multiply(BigInteger.valueOf(300));
        GasQuote quote = GasQuote.capped(GWEI.multiply(BigInteger.valueOf(400)), GWEI.multiply(BigInteger.valueOf(350)),
                GWEI.multiply(BigInteger.valueOf(1_000)), ceiling, SpeedTier.FAST, GasQuoteSource.NODE_FALLBACK);

        assertThat(quote.maxFee()).isEqualTo(ceiling);
        assertThat(quote.priorityFee()).isEqualTo(ceiling);
    }

    @Test
    void feeForMultipliesGasLimitByMaxFee() {
        GasQuote quote = new GasQuote(BigInteger.ZERO, GWEI, GWEI.multiply(BigInteger.TEN),
                SpeedTier.STANDARD, GasQuoteSource.STATIC_DEFAULT);

        assertThat(quote.feeFor(BigInteger.valueOf(21_000))).isEqualTo(BigInteger.valueOf(210_000L).multiply(GWEI));
    }
}
