package com.lpzapper.zap;

import com.lpzapper.balance.BalanceCheck;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.slippage.SlippagePolicy;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A fully prepared zap-in: bounds, calldata, gas and a passed balance check. {@code deadline} is epoch seconds.
 */
public record ZapInQuote(
        String tokenAddress,
        String pairAddress,
        BigDecimal amountEth,
        BigInteger amountWei,
        SlippagePolicy slippage,
        BigInteger amountAMin,
        BigInteger amountBMin,
        long deadline,
        String calldata,
        BigInteger gasLimit,
        GasQuote gasQuote,
        BalanceCheck balanceCheck,
        BigDecimal estimatedFeeEth,
        BigDecimal estimatedFeeUsd,
        BigDecimal marketCapEth
) {
}
