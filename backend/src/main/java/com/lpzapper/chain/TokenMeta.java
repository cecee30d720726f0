package com.lpzapper.chain;

/**
 * ERC-20 name, symbol and decimals.
 */
public record TokenMeta(String name, String symbol, int decimals) {

    public static TokenMeta unknown() {
        return new TokenMeta("Unknown Token", "N/A", 18);
    }
}
