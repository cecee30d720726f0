package com.lpzapper.ledger;

import java.util.List;

/**
 * Whole-collection persistence for the ledger: every save replaces everything.
 */
public interface PositionStore {

    /**
     * @return positions in insertion order; empty when nothing was saved yet
     * @throws LedgerPersistenceException when stored data exists but cannot be read
     */
    List<Position> load();

    /**
     * @throws LedgerPersistenceException when the write fails
     */
    void save(List<Position> positions);
}
