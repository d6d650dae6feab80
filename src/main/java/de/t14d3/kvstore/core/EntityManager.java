package de.t14d3.kvstore.core;

import de.t14d3.kvstore.Configuration;
import de.t14d3.kvstore.exceptions.NotFoundException;
import de.t14d3.kvstore.mapping.EntityMetadata;
import de.t14d3.kvstore.storage.Storage;

/**
 * The main interface for working with entities stored in a key-value storage.
 * Manages entity lifecycle through a {@link UnitOfWork}.
 */
public class EntityManager {
    private final Storage storage;
    private final UnitOfWork unitOfWork;

    private EntityManager(Storage storage, Configuration configuration) {
        this.storage = storage;
        this.unitOfWork = new UnitOfWork(storage, configuration);
    }

    /**
     * Create a new EntityManager for the given storage with default configuration.
     */
    public static EntityManager create(Storage storage) {
        return create(storage, new Configuration());
    }

    public static EntityManager create(Storage storage, Configuration configuration) {
        if (storage == null) {
            throw new IllegalArgumentException("Storage must not be null");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("Configuration must not be null");
        }
        return new EntityManager(storage, configuration);
    }

    /**
     * Find an entity by its key. Composite keys are passed as a map of identifier
     * field name to value.
     *
     * @return the managed entity, or {@code null} if the storage has no such record
     */
    public <T> T find(Class<T> entityClass, Object key) {
        if (key == null) {
            return null;
        }
        try {
            return unitOfWork.reconstitute(entityClass, key);
        } catch (NotFoundException e) {
            return null;
        }
    }

    /**
     * Mark a new entity for insertion. It is written on the next {@link #flush()}.
     */
    public void persist(Object entity) {
        if (entity == null) {
            throw new IllegalArgumentException("Cannot persist null entity");
        }
        unitOfWork.scheduleForInsert(entity);
    }

    /**
     * Mark a managed entity for removal. It is deleted on the next {@link #flush()}.
     */
    public void remove(Object entity) {
        if (entity == null) {
            throw new IllegalArgumentException("Cannot remove null entity");
        }
        unitOfWork.scheduleForDelete(entity);
    }

    /**
     * Write all pending changes to the storage.
     */
    public void flush() {
        unitOfWork.commit();
    }

    /**
     * Detach all entities. Pending changes are discarded.
     */
    public void clear() {
        unitOfWork.clear();
    }

    /**
     * Detach an entity from the EntityManager's control.
     */
    public void detach(Object entity) {
        if (entity == null) {
            throw new IllegalArgumentException("Cannot detach null entity");
        }
        unitOfWork.detach(entity);
    }

    public boolean contains(Object entity) {
        return entity != null && unitOfWork.isManaged(entity);
    }

    public EntityMetadata getClassMetadata(Class<?> entityClass) {
        return unitOfWork.getClassMetadata(entityClass);
    }

    public UnitOfWork getUnitOfWork() {
        return unitOfWork;
    }

    public Storage getStorage() {
        return storage;
    }
}
