package de.t14d3.kvstore.id;

import de.t14d3.kvstore.mapping.EntityMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leaves identifiers and records as they are.
 */
public class NullIdConverter implements IdConverter {

    @Override
    public Object serialize(EntityMetadata metadata, Object id) {
        return id;
    }

    @Override
    public Map<String, Object> unserialize(EntityMetadata metadata, Map<String, Object> data) {
        return new LinkedHashMap<>(data);
    }
}
