package com.lpzapper.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The whole ledger as one document. Decimal fields are stored as Decimal128.
 */
@Document(collection = "ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerDocument {

    @Id
    private String id;
    private List<Entry> positions = new ArrayList<>();
    private Instant updatedAt;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Entry {
        private String tokenAddress;
        private String pairAddress;
        private BigDecimal initialEthValue;
        private BigDecimal initialMarketCap;
        private long timestamp;

        static Entry from(Position position) {
            Entry e = new Entry();
            e.setTokenAddress(position.tokenAddress());
            e.setPairAddress(position.pairAddress());
            e.setInitialEthValue(position.initialBaseValue());
            e.setInitialMarketCap(position.initialMarketCap());
            e.setTimestamp(position.timestamp());
            return e;
        }

        Position toPosition() {
            return new Position(tokenAddress, pairAddress, initialEthValue, initialMarketCap, timestamp);
        }
    }
}
