package com.lpzapper.chain;

import java.math.BigInteger;

/**
 * Node fee data in wei. {@code baseFee} and {@code priorityFee} are null on nodes without EIP-1559 support.
 */
public record FeeSuggestion(BigInteger baseFee, BigInteger priorityFee, BigInteger gasPrice) {

    public boolean supportsEip1559() {
        return baseFee != null && priorityFee != null;
    }
}
