package com.lpzapper.zap.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Zapper contract and zap transaction settings.
 */
@ConfigurationProperties(prefix = "lpzapper.zap")
@NoArgsConstructor
@Getter
@Setter
public class ZapProperties {

    private String zapperAddress = "0x6cc707f9097e9e5692bC4Ad21E17Ed01659D5952";

    /** Transactions not mined within this many minutes revert on-chain. */
    private int deadlineMinutes = 2;

    /** Amounts offered in the zap-in preview. */
    private List<BigDecimal> presetAmountsEth = new ArrayList<>(List.of(
            new BigDecimal("0.001"), new BigDecimal("0.003"), new BigDecimal("0.005"), new BigDecimal("0.008")));

    /** Gas assumed for a zap-in when showing a fee before the amount is known. */
    private long zapInGasEstimate = 400_000;

    /** Gas assumed for a zap-out when showing a position's exit fee. */
    private long zapOutGasEstimate = 300_000;
}
