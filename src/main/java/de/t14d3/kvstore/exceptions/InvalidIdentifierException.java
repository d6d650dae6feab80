package de.t14d3.kvstore.exceptions;

public class InvalidIdentifierException extends KeyValueStoreException {
    public InvalidIdentifierException(String message) {
        super(message);
    }
}
