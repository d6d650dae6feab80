package de.t14d3.kvstore.storage;

import de.t14d3.kvstore.exceptions.StorageException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Storage that keeps records in process memory. Data is lost when the instance is
 * discarded.
 * <p>
 * Both capability flags are chosen at construction so the same driver can stand in for
 * whole-record stores and for stores that merge partial updates.
 */
public class InMemoryStorage implements Storage {
    private final ConcurrentHashMap<String, ConcurrentHashMap<Object, Map<String, Object>>> data = new ConcurrentHashMap<>();
    private final boolean partialUpdates;
    private final boolean compositeKeys;

    /**
     * Whole-record updates, scalar keys only.
     */
    public InMemoryStorage() {
        this(false, false);
    }

    public InMemoryStorage(boolean partialUpdates, boolean compositeKeys) {
        this.partialUpdates = partialUpdates;
        this.compositeKeys = compositeKeys;
    }

    @Override
    public boolean supportsPartialUpdates() {
        return partialUpdates;
    }

    @Override
    public boolean supportsCompositePrimaryKeys() {
        return compositeKeys;
    }

    @Override
    public boolean requiresCompositePrimaryKeys() {
        return false;
    }

    @Override
    public void insert(String storageName, Object key, Map<String, Object> record) {
        Map<String, Object> previous = table(storageName).putIfAbsent(copyKey(key), new LinkedHashMap<>(record));
        if (previous != null) {
            throw new StorageException("Record " + key + " already exists in '" + storageName + "'");
        }
    }

    @Override
    public void update(String storageName, Object key, Map<String, Object> record) {
        Map<String, Object> updated = table(storageName).computeIfPresent(copyKey(key), (k, existing) -> {
            Map<String, Object> next = partialUpdates ? new LinkedHashMap<>(existing) : new LinkedHashMap<>();
            next.putAll(record);
            return next;
        });
        if (updated == null) {
            throw new StorageException("No record " + key + " to update in '" + storageName + "'");
        }
    }

    @Override
    public void delete(String storageName, Object key) {
        table(storageName).remove(copyKey(key));
    }

    @Override
    public Optional<Map<String, Object>> find(String storageName, Object key) {
        Map<String, Object> record = table(storageName).get(copyKey(key));
        return record == null ? Optional.empty() : Optional.of(new LinkedHashMap<>(record));
    }

    @Override
    public String getName() {
        return "memory";
    }

    /**
     * Number of records currently held in the given storage.
     */
    public int count(String storageName) {
        return table(storageName).size();
    }

    private ConcurrentHashMap<Object, Map<String, Object>> table(String storageName) {
        return data.computeIfAbsent(storageName, name -> new ConcurrentHashMap<>());
    }

    private Object copyKey(Object key) {
        if (key instanceof Map<?, ?> map) {
            if (!compositeKeys) {
                throw new StorageException("Storage " + getName() + " does not support composite keys");
            }
            return new LinkedHashMap<>(map);
        }
        if (key == null) {
            throw new StorageException("Key must not be null");
        }
        return key;
    }
}
