package com.lpzapper.common.cache;

/**
 * Wraps a checked fetcher failure when there is no previous value to fall back to.
 */
public class CacheFetchException extends RuntimeException {

    public CacheFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
