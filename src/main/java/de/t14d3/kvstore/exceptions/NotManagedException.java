package de.t14d3.kvstore.exceptions;

/**
 * Thrown when an operation requires a managed entity but received one the unit of work
 * never loaded or inserted.
 */
public class NotManagedException extends KeyValueStoreException {
    public NotManagedException(Object entity) {
        super("Object of type " + entity.getClass().getName()
                + " scheduled for deletion is not managed. Only managed objects can be deleted.");
    }
}
