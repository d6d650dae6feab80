package de.t14d3.kvstore.exceptions;

/**
 * Thrown when an entity is persisted without a value for its identifier field(s).
 */
public class MissingIdentifierException extends KeyValueStoreException {
    public MissingIdentifierException(Class<?> entityClass) {
        super("Trying to persist entity of type " + entityClass.getName() + " that has no id");
    }
}
