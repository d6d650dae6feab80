package de.t14d3.kvstore.core;

import java.util.*;

/**
 * Registry of live instances by class name and identifier hash, guaranteeing one
 * in-memory instance per stored identity.
 */
final class IdentityMap {
    private record Key(String typeName, String idHash) {}

    private final Map<String, Map<String, Long>> byIdentity = new LinkedHashMap<>();
    private final Map<Long, Object> instances = new LinkedHashMap<>();
    private final Map<Long, Key> keys = new HashMap<>();

    Object get(String typeName, String idHash) {
        Map<String, Long> byHash = byIdentity.get(typeName);
        if (byHash == null) {
            return null;
        }
        Long handle = byHash.get(idHash);
        return handle == null ? null : instances.get(handle);
    }

    /**
     * Registers an instance under the given identity, replacing any previous identity
     * registered for the same handle.
     */
    void put(String typeName, String idHash, long handle, Object instance) {
        remove(handle);
        byIdentity.computeIfAbsent(typeName, t -> new LinkedHashMap<>()).put(idHash, handle);
        instances.put(handle, instance);
        keys.put(handle, new Key(typeName, idHash));
    }

    void remove(long handle) {
        Key key = keys.remove(handle);
        if (key == null) {
            return;
        }
        instances.remove(handle);
        Map<String, Long> byHash = byIdentity.get(key.typeName());
        if (byHash != null) {
            byHash.remove(key.idHash());
            if (byHash.isEmpty()) {
                byIdentity.remove(key.typeName());
            }
        }
    }

    Object instance(long handle) {
        return instances.get(handle);
    }

    /**
     * Handles in registration order, copied so callers may modify the map while iterating.
     */
    List<Long> handles() {
        return new ArrayList<>(instances.keySet());
    }

    void clear() {
        byIdentity.clear();
        instances.clear();
        keys.clear();
    }
}
