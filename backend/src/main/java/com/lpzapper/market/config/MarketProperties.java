package com.lpzapper.market.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Uniswap V2 deployment and reference tokens (Ethereum mainnet defaults).
 */
@ConfigurationProperties(prefix = "lpzapper.market")
@NoArgsConstructor
@Getter
@Setter
public class MarketProperties {

    private String factoryAddress = "0x5C69bEe701ef814a2B6a3EDD4B1652CB9cc5aA6f";

    /** Base asset of every pool (WETH). */
    private String wethAddress = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";

    /** Stablecoin whose WETH pool gives the ETH/USD price. */
    private String usdAddress = "0xdAC17F958D2ee523a2206206994597C13D831ec7";

    private int usdDecimals = 6;

    /** How long an ETH/USD price is reused. */
    private long ethUsdTtlMs = 30_000;
}
