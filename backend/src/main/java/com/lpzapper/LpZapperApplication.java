package com.lpzapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Mongo is wired by the ledger module only when {@code lpzapper.ledger.store=mongo}.
 */
@SpringBootApplication(exclude = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
public class LpZapperApplication {

    public static void main(String[] args) {
        SpringApplication.run(LpZapperApplication.class, args);
    }
}
