package de.t14d3.kvstore.exceptions;

/**
 * Failure reported by one of the bundled storage drivers.
 */
public class StorageException extends KeyValueStoreException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
