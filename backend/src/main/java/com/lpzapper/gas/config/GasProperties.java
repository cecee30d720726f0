package com.lpzapper.gas.config;

import com.lpzapper.gas.SpeedTier;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Gas fee resolution and gas-limit estimation settings. Fee values are in gwei.
 */
@ConfigurationProperties(prefix = "lpzapper.gas")
@NoArgsConstructor
@Getter
@Setter
public class GasProperties {

    /** Oracle tier to pay. */
    private SpeedTier speedTier = SpeedTier.STANDARD;

    /** Applied to the selected oracle price (e.g. 1.1 for a 10% bump). */
    private BigDecimal multiplier = BigDecimal.ONE;

    /** Floor for the priority fee. */
    private BigDecimal minPriorityFeeGwei = new BigDecimal("1");

    /** Hard cap on maxFeePerGas whatever the source says. */
    private BigDecimal ceilingGwei = new BigDecimal("300");

    /** Max fee used when both the oracle and the node fail. */
    private BigDecimal staticDefaultMaxFeeGwei = new BigDecimal("10");

    /** How long a tier's quote is served without refetching. */
    private long quoteTtlMs = 8_000;

    /** Safety factor on eth_estimateGas. */
    private BigDecimal gasLimitMultiplier = new BigDecimal("1.2");

    private Oracle oracle = new Oracle();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Oracle {

        /** Disable to go straight to the node tier. */
        private boolean enabled = true;

        /** Etherscan-compatible API base; module=gastracker&action=gasoracle is appended. */
        private String url = "https://api.etherscan.io/api";

        private String apiKey = "";

        /** Oracle call budget; calls beyond it fail over to the node tier without waiting. */
        private int requestsPerSecond = 4;

        private long timeoutMs = 3_000;
    }
}
