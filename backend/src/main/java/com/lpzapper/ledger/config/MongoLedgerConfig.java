package com.lpzapper.ledger.config;

import com.lpzapper.ledger.MongoPositionStore;
import com.lpzapper.ledger.PositionStore;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.time.Clock;
import java.util.List;

/**
 * MongoDB ledger store, only when {@code lpzapper.ledger.store=mongo}. Mongo auto-configuration is off so the
 * default file setup never opens a client; this class builds the client and template itself.
 * Decimal128 is used for all BigDecimal fields.
 */
@Configuration
@ConditionalOnProperty(prefix = "lpzapper.ledger", name = "store", havingValue = "mongo")
@Slf4j
public class MongoLedgerConfig {

    @Bean(destroyMethod = "close")
    public MongoClient ledgerMongoClient(LedgerProperties properties) {
        log.info("Position ledger in MongoDB database {}", properties.getMongo().getDatabase());
        return MongoClients.create(properties.getMongo().getUri());
    }

    @Bean
    public MongoTemplate ledgerMongoTemplate(MongoClient ledgerMongoClient, LedgerProperties properties) {
        return mongoTemplate(ledgerMongoClient, properties.getMongo().getDatabase());
    }

    @Bean
    public PositionStore mongoPositionStore(MongoTemplate ledgerMongoTemplate, LedgerProperties properties, Clock clock) {
        return new MongoPositionStore(ledgerMongoTemplate, properties.getMongo().getDocumentId(), clock);
    }

    public static MongoTemplate mongoTemplate(MongoClient client, String database) {
        SimpleMongoClientDatabaseFactory factory = new SimpleMongoClientDatabaseFactory(client, database);
        MongoCustomConversions conversions = new MongoCustomConversions(List.of(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()
        ));
        MongoMappingContext mappingContext = new MongoMappingContext();
        mappingContext.setSimpleTypeHolder(conversions.getSimpleTypeHolder());
        mappingContext.afterPropertiesSet();
        MappingMongoConverter converter = new MappingMongoConverter(new DefaultDbRefResolver(factory), mappingContext);
        converter.setCustomConversions(conversions);
        converter.afterPropertiesSet();
        return new MongoTemplate(factory, converter);
    }
}
