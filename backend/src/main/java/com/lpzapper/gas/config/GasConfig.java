package com.lpzapper.gas.config;

import com.lpzapper.common.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Gas module configuration: properties and the oracle call limiter.
 */
@Configuration
@EnableConfigurationProperties(GasProperties.class)
public class GasConfig {

    @Bean
    public RateLimiter gasOracleRateLimiter(GasProperties gasProperties) {
        return new RateLimiter(Math.max(1, gasProperties.getOracle().getRequestsPerSecond()), Duration.ofSeconds(1));
    }
}
