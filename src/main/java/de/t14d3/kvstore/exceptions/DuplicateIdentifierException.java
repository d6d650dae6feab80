package de.t14d3.kvstore.exceptions;

/**
 * Thrown when a new entity is scheduled for insertion while another instance with the
 * same identifier is already managed.
 */
public class DuplicateIdentifierException extends KeyValueStoreException {
    public DuplicateIdentifierException(Class<?> entityClass, Object id) {
        super("Object of type " + entityClass.getName() + " with id " + id + " already exists");
    }
}
