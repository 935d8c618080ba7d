package com.kakeibo.ledger.store;

import com.kakeibo.ledger.exception.PersistenceException;

import java.util.List;

/**
 * Durable storage for the ledger's record collections.
 */
public interface LedgerRepository {

    /**
     * Load a collection. Returns an empty mutable list when the document is absent
     * or cannot be parsed; never fails on bad stored data.
     */
    <T> List<T> load(LedgerCollection<T> collection);

    /**
     * Replace the stored contents of a collection.
     *
     * @throws PersistenceException if the write fails
     */
    <T> void save(LedgerCollection<T> collection, List<T> records);
}
