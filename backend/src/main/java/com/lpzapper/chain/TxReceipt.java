package com.lpzapper.chain;

import java.math.BigInteger;

public record TxReceipt(String txHash, BigInteger blockNumber, BigInteger gasUsed, BigInteger effectiveGasPrice, boolean success) {
}
