package de.t14d3.kvstore.exceptions;

/**
 * Base type of every error raised by the key-value store core.
 */
public class KeyValueStoreException extends RuntimeException {
    public KeyValueStoreException(String message) {
        super(message);
    }

    public KeyValueStoreException(Throwable cause) {
        super(cause);
    }

    public KeyValueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
