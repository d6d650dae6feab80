package de.t14d3.kvstore.id;

import de.t14d3.kvstore.exceptions.InvalidIdentifierException;
import de.t14d3.kvstore.mapping.EntityMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifiers are ordered maps of identifier field name to value, even for classes with
 * a single identifier field.
 */
public class CompositeIdHandler implements IdHandler {

    @Override
    public Object normalizeId(EntityMetadata metadata, Object key) {
        if (!(key instanceof Map<?, ?> map)) {
            if (metadata.isCompositeKey()) {
                throw new InvalidIdentifierException("Array of identifier key-value pairs is expected for "
                        + metadata.getName());
            }
            if (key == null) {
                throw new InvalidIdentifierException("Identifier of " + metadata.getName() + " must not be null");
            }
            Map<String, Object> id = new LinkedHashMap<>();
            id.put(metadata.getIdentifier().get(0), key);
            return id;
        }

        Map<String, Object> id = new LinkedHashMap<>();
        for (String field : metadata.getIdentifier()) {
            Object value = map.get(field);
            if (value == null) {
                throw new InvalidIdentifierException("Missing identifier field " + field
                        + " in request for the primary key of " + metadata.getName());
            }
            id.put(field, value);
        }
        return id;
    }

    @Override
    public Object getIdentifier(EntityMetadata metadata, Object entity) {
        Map<String, Object> values = metadata.getIdentifierValues(entity);
        if (values.containsValue(null)) {
            return null;
        }
        return values;
    }

    /**
     * Length-prefixes every name and value ({@code 5:hotel=2:H1;4:room=1:7;}), so the hash
     * stays unambiguous whatever characters the components contain.
     */
    @Override
    public String hash(Object id) {
        if (!(id instanceof Map<?, ?> map)) {
            return String.valueOf(id);
        }
        StringBuilder hash = new StringBuilder();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            String value = String.valueOf(entry.getValue());
            hash.append(name.length()).append(':').append(name).append('=')
                    .append(value.length()).append(':').append(value).append(';');
        }
        return hash.toString();
    }
}
