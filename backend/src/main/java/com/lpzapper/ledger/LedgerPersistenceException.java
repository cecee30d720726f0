package com.lpzapper.ledger;

/**
 * Ledger could not be read or written.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
