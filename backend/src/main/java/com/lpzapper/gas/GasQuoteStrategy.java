package com.lpzapper.gas;

/**
 * One tier of the gas fee fallback chain.
 */
public interface GasQuoteStrategy {

    GasQuoteSource source();

    /**
     * Try to produce a quote. Implementations report failures in the result instead of throwing.
     */
    GasQuoteResult attempt();
}
