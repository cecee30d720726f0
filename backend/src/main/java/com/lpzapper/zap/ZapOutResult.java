package com.lpzapper.zap;

import java.math.BigInteger;

/**
 * Confirmed zap-out. {@code positionClosed} is true after a 100% exit.
 */
public record ZapOutResult(
        String txHash,
        String approveTxHash,
        String tokenAddress,
        int percent,
        BigInteger liquidity,
        boolean positionClosed,
        BigInteger blockNumber,
        BigInteger gasUsed
) {
}
