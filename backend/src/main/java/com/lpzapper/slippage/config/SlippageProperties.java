package com.lpzapper.slippage.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Slippage tolerance settings, in basis points.
 */
@ConfigurationProperties(prefix = "lpzapper.slippage")
@NoArgsConstructor
@Getter
@Setter
public class SlippageProperties {

    /** When false every trade uses {@link #staticBps}. */
    private boolean dynamicEnabled = true;

    private int minBps = 50;

    private int maxBps = 3_000;

    /** Fixed tolerance when dynamic slippage is disabled (20%). */
    private int staticBps = 2_000;
}
