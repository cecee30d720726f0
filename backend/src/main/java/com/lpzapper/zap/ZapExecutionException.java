package com.lpzapper.zap;

import lombok.Getter;

/**
 * A zap could not be carried out on-chain: missing pair, revert on estimate or execution, no LP tokens,
 * or no confirmation in time. The ledger is not touched. {@code txHash} is set once a transaction was broadcast.
 */
@Getter
public class ZapExecutionException extends RuntimeException {

    private final String txHash;

    public ZapExecutionException(String message) {
        this(message, null, null);
    }

    public ZapExecutionException(String message, String txHash, Throwable cause) {
        super(message, cause);
        this.txHash = txHash;
    }
}
