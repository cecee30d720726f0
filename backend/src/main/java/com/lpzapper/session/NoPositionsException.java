package com.lpzapper.session;

/**
 * The ledger is empty, so there is nothing to show or watch.
 */
public class NoPositionsException extends RuntimeException {

    public NoPositionsException() {
        super("No positions found.");
    }
}
