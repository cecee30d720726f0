package com.lpzapper.slippage.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SlippageProperties.class)
public class SlippageConfig {
}
