package com.lpzapper.chain;

import java.math.BigInteger;

/**
 * EIP-1559 transaction to be signed by the custodial account. Fees in wei.
 */
public record TransactionRequest(
        String to,
        BigInteger value,
        String data,
        BigInteger gasLimit,
        BigInteger maxPriorityFeePerGas,
        BigInteger maxFeePerGas
) {
}
