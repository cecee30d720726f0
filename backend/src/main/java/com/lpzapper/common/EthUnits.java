package com.lpzapper.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Wei / gwei / ether conversions. Decimal results use scale 18 with HALF_UP; conversions to wei truncate.
 */
public final class EthUnits {

    public static final int SCALE = 18;
    public static final BigDecimal WEI_PER_ETH = BigDecimal.TEN.pow(18);
    public static final BigDecimal WEI_PER_GWEI = BigDecimal.TEN.pow(9);

    private EthUnits() {
    }

    public static BigInteger ethToWei(BigDecimal eth) {
        return eth.multiply(WEI_PER_ETH).toBigInteger();
    }

    public static BigDecimal weiToEth(BigInteger wei) {
        if (wei == null) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(wei).divide(WEI_PER_ETH, SCALE, RoundingMode.HALF_UP);
    }

    public static BigInteger gweiToWei(BigDecimal gwei) {
        return gwei.multiply(WEI_PER_GWEI).toBigInteger();
    }

    public static BigDecimal weiToGwei(BigInteger wei) {
        if (wei == null) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(wei).divide(WEI_PER_GWEI, 9, RoundingMode.HALF_UP);
    }

    /**
     * Parses a user-typed, strictly positive decimal ETH amount; empty for blank, malformed, zero or negative input.
     */
    public static Optional<BigDecimal> parsePositiveEth(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            BigDecimal value = new BigDecimal(text.trim());
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a JSON-RPC quantity ("0x1a") into a BigInteger. Null, blank and "0x" map to zero.
     */
    public static BigInteger hexToBigInteger(String hex) {
        if (hex == null || hex.isBlank()) {
            return BigInteger.ZERO;
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isBlank()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(digits, 16);
    }

    public static String toHexQuantity(BigInteger value) {
        return "0x" + (value == null ? BigInteger.ZERO : value).toString(16);
    }
}
