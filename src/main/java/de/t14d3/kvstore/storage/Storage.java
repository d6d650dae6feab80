package de.t14d3.kvstore.storage;

import java.util.Map;
import java.util.Optional;

/**
 * Storage driver abstraction the unit of work writes through.
 * <p>
 * Calls are blocking. Failures are reported by throwing; the unit of work propagates
 * them unchanged. Capability flags are read once per unit of work and must not change
 * over the lifetime of a driver.
 */
public interface Storage {

    /**
     * Whether {@link #update} accepts just the changed fields. When {@code false} the
     * unit of work always passes the complete record.
     */
    boolean supportsPartialUpdates();

    /**
     * Whether keys may be ordered maps of identifier field to value.
     */
    boolean supportsCompositePrimaryKeys();

    /**
     * Whether keys must be ordered maps, even for single-field identifiers. A unit of work
     * over such a storage passes map keys whatever {@link #supportsCompositePrimaryKeys()}
     * reports.
     */
    boolean requiresCompositePrimaryKeys();

    void insert(String storageName, Object key, Map<String, Object> data);

    void update(String storageName, Object key, Map<String, Object> data);

    void delete(String storageName, Object key);

    /**
     * Loads the record stored under the key, or an empty optional if there is none.
     */
    Optional<Map<String, Object>> find(String storageName, Object key);

    /**
     * Short name of the driver, for diagnostics.
     */
    String getName();
}
