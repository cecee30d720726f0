package com.lpzapper.gas;

/**
 * A gas tier could not produce a quote.
 */
public class GasQuoteUnavailableException extends RuntimeException {

    public GasQuoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
