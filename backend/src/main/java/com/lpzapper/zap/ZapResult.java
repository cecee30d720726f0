package com.lpzapper.zap;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Confirmed zap-in and where it landed in the ledger.
 */
public record ZapResult(
        String txHash,
        String tokenAddress,
        BigDecimal amountEth,
        BigDecimal marketCapEth,
        int positionIndex,
        BigInteger blockNumber,
        BigInteger gasUsed
) {
}
