package com.kakeibo.ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kakeibo.ledger.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps each collection as a serialized JSON string in memory. Records round-trip
 * through the same mapping as the file store, so callers never share instances
 * with what is stored.
 */
@Slf4j
public class InMemoryLedgerRepository implements LedgerRepository {

    private final Map<String, String> storage = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryLedgerRepository() {
        this(new ObjectMapper());
    }

    public InMemoryLedgerRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> List<T> load(LedgerCollection<T> collection) {
        String json = storage.get(collection.getKey());
        if (json == null) {
            return new ArrayList<>();
        }
        JavaType listType = objectMapper.getTypeFactory()
                .constructCollectionType(ArrayList.class, collection.getRecordType());
        try {
            List<T> records = objectMapper.readValue(json, listType);
            return records != null ? records : new ArrayList<>();
        } catch (JsonProcessingException e) {
            log.warn("Stored document for {} is unreadable, falling back to empty: {}",
                    collection, e.getOriginalMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public <T> void save(LedgerCollection<T> collection, List<T> records) {
        try {
            storage.put(collection.getKey(), objectMapper.writeValueAsString(records));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + collection, e);
        }
    }

    /**
     * Seed a collection with a raw JSON document, as if written by an older version.
     */
    public void putRaw(LedgerCollection<?> collection, String json) {
        storage.put(collection.getKey(), json);
    }

    public String getRaw(LedgerCollection<?> collection) {
        return storage.get(collection.getKey());
    }
}
