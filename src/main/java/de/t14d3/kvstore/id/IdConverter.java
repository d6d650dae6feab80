package de.t14d3.kvstore.id;

import de.t14d3.kvstore.mapping.EntityMetadata;

import java.util.Map;

/**
 * Converts identifiers between their in-memory form and the form a storage driver
 * expects on the wire.
 */
public interface IdConverter {

    /**
     * Converts a canonical identifier into the value passed to the storage driver.
     */
    Object serialize(EntityMetadata metadata, Object id);

    /**
     * Cleans a record fetched from storage before it is assigned to an instance.
     * Returns a new map; the argument is left untouched.
     */
    Map<String, Object> unserialize(EntityMetadata metadata, Map<String, Object> data);
}
