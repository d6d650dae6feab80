package de.t14d3.kvstore.exceptions;

/**
 * Thrown when an entity is requested by identifier but the storage has no record for it.
 */
public class NotFoundException extends KeyValueStoreException {
    private final String storageName;
    private final Object id;

    public NotFoundException(String storageName, Object id) {
        super("No record with id " + id + " in storage '" + storageName + "'");
        this.storageName = storageName;
        this.id = id;
    }

    public String getStorageName() {
        return storageName;
    }

    public Object getId() {
        return id;
    }
}
