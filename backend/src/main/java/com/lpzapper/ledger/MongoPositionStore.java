package com.lpzapper.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Stores the ledger as a single document replaced on every save.
 */
@Slf4j
public class MongoPositionStore implements PositionStore {

    private final MongoTemplate mongoTemplate;
    private final String documentId;
    private final Clock clock;

    public MongoPositionStore(MongoTemplate mongoTemplate, String documentId, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.documentId = documentId;
        this.clock = clock;
    }

    @Override
    public List<Position> load() {
        try {
            LedgerDocument doc = mongoTemplate.findById(documentId, LedgerDocument.class);
            if (doc == null || doc.getPositions() == null) {
                return List.of();
            }
            return doc.getPositions().stream().map(LedgerDocument.Entry::toPosition).toList();
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Cannot read ledger document " + documentId, e);
        }
    }

    @Override
    public void save(List<Position> positions) {
        LedgerDocument doc = new LedgerDocument();
        doc.setId(documentId);
        doc.setPositions(positions.stream().map(LedgerDocument.Entry::from).toList());
        doc.setUpdatedAt(clock.instant());
        try {
            mongoTemplate.save(doc);
            log.debug("Saved {} positions to ledger document {}", positions.size(), documentId);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Cannot write ledger document " + documentId, e);
        }
    }
}
