package com.lpzapper.ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the position ledger is kept.
 */
@ConfigurationProperties(prefix = "lpzapper.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** file or mongo. */
    private StoreType store = StoreType.FILE;

    /** JSON file used by the file store. */
    private String filePath = "./positions.json";

    private Mongo mongo = new Mongo();

    public enum StoreType {
        FILE,
        MONGO
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Mongo {

        private String uri = "mongodb://localhost:27017";

        private String database = "lpzapper";

        /** Id of the single ledger document. */
        private String documentId = "default";
    }
}
