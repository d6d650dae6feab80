package de.t14d3.kvstore.exceptions;

/**
 * Raised for classes that cannot be mapped, or whose fields cannot be read or written.
 */
public class MappingException extends KeyValueStoreException {
    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
