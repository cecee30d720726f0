package com.lpzapper.gas;

/**
 * Which tier of the fallback chain produced a quote.
 */
public enum GasQuoteSource {
    PRIMARY_ORACLE,
    NODE_FALLBACK,
    STATIC_DEFAULT
}
