package de.t14d3.kvstore.id;

import de.t14d3.kvstore.mapping.EntityMetadata;

/**
 * Strategy for the shape of identifiers: a single scalar value, or an ordered map of
 * identifier field name to value.
 * <p>
 * The unit of work picks one implementation at construction time, depending on whether
 * the storage supports composite primary keys.
 */
public interface IdHandler {

    /**
     * Turns a caller supplied key into the canonical identifier for the given class.
     *
     * @throws de.t14d3.kvstore.exceptions.InvalidIdentifierException if the key does not
     *         carry every declared identifier field
     */
    Object normalizeId(EntityMetadata metadata, Object key);

    /**
     * Reads the identifier off a live instance, or returns {@code null} if it has none yet.
     */
    Object getIdentifier(EntityMetadata metadata, Object entity);

    /**
     * Deterministic lookup key for an identifier in its canonical form.
     */
    String hash(Object id);
}
