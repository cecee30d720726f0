package com.lpzapper.chain;

import java.math.BigInteger;

/**
 * Signs transactions for the single custodial account.
 */
public interface TransactionSigner {

    /** Checksummed address of the account. */
    String address();

    /** False in watch-only mode (no key configured). */
    boolean canSign();

    /**
     * @return raw signed transaction as 0x-prefixed hex, ready for eth_sendRawTransaction
     */
    String sign(long chainId, BigInteger nonce, TransactionRequest request);
}
