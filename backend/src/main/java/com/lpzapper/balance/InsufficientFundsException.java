package com.lpzapper.balance;

import lombok.Getter;

import java.math.BigInteger;

import static com.lpzapper.common.EthUnits.weiToEth;

/**
 * The account cannot cover amount plus worst-case fee. Amounts in wei.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final BigInteger balance;
    private final BigInteger spend;
    private final BigInteger estimatedFee;
    private final BigInteger required;

    public InsufficientFundsException(BigInteger balance, BigInteger spend, BigInteger estimatedFee) {
        super(message(balance, spend, estimatedFee));
        this.balance = balance;
        this.spend = spend;
        this.estimatedFee = estimatedFee;
        this.required = spend.add(estimatedFee);
    }

    public BigInteger getShortfall() {
        return required.subtract(balance);
    }

    private static String message(BigInteger balance, BigInteger spend, BigInteger fee) {
        BigInteger required = spend.add(fee);
        return "Insufficient ETH balance: need " + eth(required)
                + " ETH (amount " + eth(spend) + " + est. fee " + eth(fee)
                + "), have " + eth(balance) + " ETH, short by " + eth(required.subtract(balance)) + " ETH";
    }

    private static String eth(BigInteger wei) {
        return weiToEth(wei).stripTrailingZeros().toPlainString();
    }
}
