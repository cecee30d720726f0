package com.lpzapper.balance;

import com.lpzapper.gas.GasQuote;

import java.math.BigInteger;

/**
 * Passed balance check: what the account holds and what the transaction may cost at most (wei).
 */
public record BalanceCheck(
        BigInteger balance,
        BigInteger spend,
        BigInteger gasLimit,
        BigInteger estimatedFee,
        BigInteger required,
        GasQuote quote
) {

    public BigInteger headroom() {
        return balance.subtract(required);
    }
}
