package de.t14d3.kvstore.id;

import de.t14d3.kvstore.exceptions.InvalidIdentifierException;
import de.t14d3.kvstore.mapping.EntityMetadata;

import java.util.Map;

/**
 * Identifiers are single scalar values. Used with storages that cannot address
 * records by more than one key component.
 */
public class SingleIdHandler implements IdHandler {

    @Override
    public Object normalizeId(EntityMetadata metadata, Object key) {
        if (metadata.isCompositeKey()) {
            throw new InvalidIdentifierException("SingleIdHandler does not support composite primary keys ("
                    + metadata.getName() + " declares " + metadata.getIdentifier() + ")");
        }
        if (key instanceof Map<?, ?> map) {
            String field = metadata.getIdentifier().get(0);
            key = map.get(field);
            if (key == null) {
                throw new InvalidIdentifierException("Missing identifier field " + field
                        + " in request for the primary key of " + metadata.getName());
            }
        }
        if (key == null) {
            throw new InvalidIdentifierException("Identifier of " + metadata.getName() + " must not be null");
        }
        return key;
    }

    @Override
    public Object getIdentifier(EntityMetadata metadata, Object entity) {
        if (metadata.isCompositeKey()) {
            throw new InvalidIdentifierException("SingleIdHandler does not support composite primary keys ("
                    + metadata.getName() + ")");
        }
        return metadata.getIdentifierValues(entity).values().iterator().next();
    }

    @Override
    public String hash(Object id) {
        return String.valueOf(id);
    }
}
