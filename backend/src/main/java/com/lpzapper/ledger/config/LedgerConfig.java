package com.lpzapper.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lpzapper.ledger.FilePositionStore;
import com.lpzapper.ledger.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Ledger properties and the default file-backed store.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "lpzapper.ledger", name = "store", havingValue = "file", matchIfMissing = true)
    public PositionStore filePositionStore(LedgerProperties properties, ObjectMapper objectMapper) {
        FilePositionStore store = new FilePositionStore(Path.of(properties.getFilePath()), objectMapper);
        log.info("Position ledger file: {}", store.getFile());
        return store;
    }
}
