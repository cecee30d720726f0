package com.lpzapper.balance;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.gas.GasPriceResolver;
import com.lpzapper.gas.GasQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Checks that the custodial account can pay {@code spend + gasLimit × maxFee}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceValidator {

    private final ChainGateway chainGateway;
    private final GasPriceResolver gasPriceResolver;

    /**
     * Checks against a freshly resolved gas quote.
     *
     * @throws InsufficientFundsException when the balance is below amount plus fee
     */
    public BalanceCheck check(BigInteger spendWei, BigInteger gasLimit) {
        return check(spendWei, gasLimit, gasPriceResolver.resolve());
    }

    public BalanceCheck check(BigInteger spendWei, BigInteger gasLimit, GasQuote quote) {
        if (spendWei.signum() < 0 || gasLimit.signum() < 0) {
            throw new IllegalArgumentException("spend and gasLimit must be non-negative");
        }
        BigInteger fee = quote.feeFor(gasLimit);
        BigInteger required = spendWei.add(fee);
        BigInteger balance = chainGateway.getBalance(chainGateway.accountAddress());
        if (balance.compareTo(required) < 0) {
            InsufficientFundsException e = new InsufficientFundsException(balance, spendWei, fee);
            log.info("Balance check failed for {}: {}", chainGateway.accountAddress(), e.getMessage());
            throw e;
        }
        return new BalanceCheck(balance, spendWei, gasLimit, fee, required, quote);
    }
}
