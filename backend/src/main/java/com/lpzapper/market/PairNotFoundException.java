package com.lpzapper.market;

/**
 * The factory has no WETH pair for the token.
 */
public class PairNotFoundException extends RuntimeException {

    public PairNotFoundException(String tokenAddress) {
        super("No WETH pair found for token " + tokenAddress);
    }
}
