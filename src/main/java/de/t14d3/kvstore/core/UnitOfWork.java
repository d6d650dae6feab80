package de.t14d3.kvstore.core;

import de.t14d3.kvstore.Configuration;
import de.t14d3.kvstore.exceptions.DuplicateIdentifierException;
import de.t14d3.kvstore.exceptions.MappingException;
import de.t14d3.kvstore.exceptions.MissingIdentifierException;
import de.t14d3.kvstore.exceptions.NotFoundException;
import de.t14d3.kvstore.exceptions.NotManagedException;
import de.t14d3.kvstore.id.CompositeIdHandler;
import de.t14d3.kvstore.id.IdConverter;
import de.t14d3.kvstore.id.IdHandler;
import de.t14d3.kvstore.id.SingleIdHandler;
import de.t14d3.kvstore.mapping.EntityMetadata;
import de.t14d3.kvstore.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Tracks the entities loaded from or scheduled for a {@link Storage} and writes their
 * changes back in one pass.
 * <p>
 * {@link #commit()} runs updates of managed entities first, then insertions, then
 * deletions. Updates are found by diffing each managed entity against the data last
 * read from or written to storage; unchanged entities cause no storage call.
 * <p>
 * A unit of work is meant for one request or job on one thread; it is not thread-safe.
 * Storage errors propagate unchanged and abort the running commit. Work that completed
 * before the failure stays applied.
 */
public class UnitOfWork {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final Storage storage;
    private final IdHandler idHandler;
    private final IdConverter idConverter;
    private final boolean partialUpdates;
    private final ObjectSnapshotter snapshotter = new ObjectSnapshotter();

    private final InstanceHandles handles = new InstanceHandles();
    private final IdentityMap identityMap = new IdentityMap();
    /** Serialized identifiers, as passed to the storage. */
    private final Map<Long, Object> identifiers = new HashMap<>();
    private final Map<Long, Map<String, Object>> originalData = new HashMap<>();
    private final Map<Long, Object> scheduledInsertions = new LinkedHashMap<>();
    private final Map<Long, Object> scheduledDeletions = new LinkedHashMap<>();

    public UnitOfWork(Storage storage, Configuration configuration) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.idConverter = configuration.getIdConverter();
        this.partialUpdates = storage.supportsPartialUpdates();
        this.idHandler = storage.supportsCompositePrimaryKeys() || storage.requiresCompositePrimaryKeys()
                ? new CompositeIdHandler()
                : new SingleIdHandler();
    }

    public EntityMetadata getClassMetadata(Class<?> entityClass) {
        return EntityMetadata.of(entityClass);
    }

    /**
     * Loads an entity by key, returning the already managed instance for a known identity.
     *
     * @throws NotFoundException if the storage has no record for the key
     */
    public <T> T reconstitute(Class<T> entityClass, Object key) {
        EntityMetadata metadata = entityMetadata(entityClass);
        Object id = idHandler.normalizeId(metadata, key);
        Object storageId = idConverter.serialize(metadata, id);

        Map<String, Object> data = storage.find(metadata.getStorageName(), storageId)
                .orElseThrow(() -> new NotFoundException(metadata.getStorageName(), storageId));

        return entityClass.cast(createEntity(metadata, id, data));
    }

    /**
     * Builds and registers a managed instance from a stored record. If an instance with
     * the same identity is already managed it is returned unchanged.
     *
     * @param id the normalized identifier
     */
    public Object createEntity(EntityMetadata metadata, Object id, Map<String, Object> data) {
        String idHash = idHandler.hash(id);
        Object existing = identityMap.get(metadata.getName(), idHash);
        if (existing != null) {
            return existing;
        }

        Object entity = metadata.newInstance();
        long handle = handles.register(entity);
        originalData.put(handle, new LinkedHashMap<>(data));

        snapshotter.hydrate(metadata, entity, idConverter.unserialize(metadata, data), this::createEmbeddedEntity);
        assignIdentifier(metadata, entity, id);

        identifiers.put(handle, idConverter.serialize(metadata, id));
        identityMap.put(metadata.getName(), idHash, handle, entity);
        return entity;
    }

    /**
     * Builds an embedded instance from its nested record. Embedded instances are never tracked.
     */
    public Object createEmbeddedEntity(EntityMetadata metadata, Map<String, Object> data) {
        Object embedded = metadata.newInstance();
        snapshotter.hydrate(metadata, embedded, idConverter.unserialize(metadata, data), this::createEmbeddedEntity);
        return embedded;
    }

    /**
     * Schedules a new entity for insertion on the next commit. Does nothing for an entity
     * that is already managed or already scheduled.
     *
     * @throws MissingIdentifierException   if the entity has no identifier value
     * @throws DuplicateIdentifierException if another instance with the same identity is managed
     */
    public void scheduleForInsert(Object entity) {
        Long handle = handles.peek(entity);
        if (handle != null && identifiers.containsKey(handle)) {
            return;
        }

        EntityMetadata metadata = entityMetadata(entity.getClass());
        Object id = idHandler.getIdentifier(metadata, entity);
        if (id == null) {
            throw new MissingIdentifierException(entity.getClass());
        }

        String idHash = idHandler.hash(id);
        Object existing = identityMap.get(metadata.getName(), idHash);
        if (existing == entity) {
            return;
        }
        if (existing != null) {
            throw new DuplicateIdentifierException(entity.getClass(), id);
        }

        long newHandle = handles.register(entity);
        scheduledInsertions.put(newHandle, entity);
        identityMap.put(metadata.getName(), idHash, newHandle, entity);
    }

    /**
     * Schedules a managed entity for deletion on the next commit.
     *
     * @throws NotManagedException if the entity was never loaded or inserted by this unit of work
     */
    public void scheduleForDelete(Object entity) {
        Long handle = handles.peek(entity);
        if (handle == null || !identifiers.containsKey(handle)) {
            throw new NotManagedException(entity);
        }
        scheduledDeletions.put(handle, entity);
    }

    /**
     * Writes all pending work to the storage: changed managed entities, then scheduled
     * insertions, then scheduled deletions.
     */
    public void commit() {
        processIdentityMap();
        processInsertions();
        processDeletions();

        scheduledInsertions.clear();
        scheduledDeletions.clear();
    }

    /**
     * Detaches every entity. Pending insertions and deletions are discarded without
     * touching the storage.
     */
    public void clear() {
        scheduledInsertions.clear();
        scheduledDeletions.clear();
        identifiers.clear();
        originalData.clear();
        identityMap.clear();
        handles.clear();
    }

    /**
     * Stops tracking a single entity, including any insertion or deletion scheduled for it.
     */
    public void detach(Object entity) {
        Long handle = handles.peek(entity);
        if (handle == null) {
            return;
        }
        scheduledInsertions.remove(handle);
        scheduledDeletions.remove(handle);
        identifiers.remove(handle);
        originalData.remove(handle);
        identityMap.remove(handle);
        handles.release(entity);
    }

    /**
     * Whether the entity was loaded or inserted by this unit of work and not deleted since.
     */
    public boolean isManaged(Object entity) {
        Long handle = handles.peek(entity);
        return handle != null && identifiers.containsKey(handle);
    }

    public boolean isScheduledForInsert(Object entity) {
        Long handle = handles.peek(entity);
        return handle != null && scheduledInsertions.containsKey(handle);
    }

    public boolean isScheduledForDelete(Object entity) {
        Long handle = handles.peek(entity);
        return handle != null && scheduledDeletions.containsKey(handle);
    }

    /**
     * The serialized identifier a managed entity is stored under, or {@code null}.
     */
    public Object getIdentifier(Object entity) {
        Long handle = handles.peek(entity);
        return handle == null ? null : identifiers.get(handle);
    }

    private void processIdentityMap() {
        for (long handle : identityMap.handles()) {
            if (scheduledInsertions.containsKey(handle)) {
                continue;
            }

            Object entity = identityMap.instance(handle);
            EntityMetadata metadata = getClassMetadata(entity.getClass());
            Map<String, Object> changeSet = computeChangeSet(metadata, handle, entity);
            if (changeSet.isEmpty()) {
                continue;
            }

            Object id = identifiers.get(handle);
            log.debug("Updating {} in '{}' with {} field(s)", id, metadata.getStorageName(), changeSet.size());
            storage.update(metadata.getStorageName(), id, new LinkedHashMap<>(changeSet));

            if (partialUpdates) {
                Map<String, Object> merged = new LinkedHashMap<>(originalData.get(handle));
                merged.putAll(changeSet);
                originalData.put(handle, merged);
            } else {
                originalData.put(handle, changeSet);
            }
        }
    }

    /**
     * Fields whose current value is missing from, or not equal to, the original data.
     * Storages without partial updates get the original data merged with those fields.
     */
    private Map<String, Object> computeChangeSet(EntityMetadata metadata, long handle, Object entity) {
        Map<String, Object> snapshot = snapshotter.snapshot(metadata, entity);
        Map<String, Object> original = originalData.getOrDefault(handle, Map.of());

        Map<String, Object> changeSet = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : snapshot.entrySet()) {
            if (!original.containsKey(field.getKey())
                    || !Objects.deepEquals(original.get(field.getKey()), field.getValue())) {
                changeSet.put(field.getKey(), field.getValue());
            }
        }

        if (!changeSet.isEmpty() && !partialUpdates) {
            Map<String, Object> merged = new LinkedHashMap<>(original);
            merged.putAll(changeSet);
            return merged;
        }
        return changeSet;
    }

    private void processInsertions() {
        Iterator<Map.Entry<Long, Object>> pending = scheduledInsertions.entrySet().iterator();
        while (pending.hasNext()) {
            Map.Entry<Long, Object> entry = pending.next();
            long handle = entry.getKey();
            Object entity = entry.getValue();
            EntityMetadata metadata = getClassMetadata(entity.getClass());

            Object id = idHandler.getIdentifier(metadata, entity);
            if (id == null) {
                throw new MissingIdentifierException(entity.getClass());
            }
            Object storageId = idConverter.serialize(metadata, id);
            Map<String, Object> data = snapshotter.snapshot(metadata, entity);

            log.debug("Inserting {} into '{}'", storageId, metadata.getStorageName());
            storage.insert(metadata.getStorageName(), storageId, new LinkedHashMap<>(data));

            originalData.put(handle, data);
            identifiers.put(handle, storageId);
            identityMap.put(metadata.getName(), idHandler.hash(id), handle, entity);
            pending.remove();
        }
    }

    private void processDeletions() {
        Iterator<Map.Entry<Long, Object>> pending = scheduledDeletions.entrySet().iterator();
        while (pending.hasNext()) {
            Map.Entry<Long, Object> entry = pending.next();
            long handle = entry.getKey();
            Object entity = entry.getValue();
            EntityMetadata metadata = getClassMetadata(entity.getClass());
            Object id = identifiers.get(handle);

            log.debug("Deleting {} from '{}'", id, metadata.getStorageName());
            storage.delete(metadata.getStorageName(), id);

            identifiers.remove(handle);
            originalData.remove(handle);
            identityMap.remove(handle);
            handles.release(entity);
            pending.remove();
        }
    }

    private void assignIdentifier(EntityMetadata metadata, Object entity, Object id) {
        if (id instanceof Map<?, ?> components) {
            for (String field : metadata.getIdentifier()) {
                metadata.setFieldValue(entity, metadata.getField(field), components.get(field));
            }
        } else {
            metadata.setFieldValue(entity, metadata.getField(metadata.getIdentifier().get(0)), id);
        }
    }

    private EntityMetadata entityMetadata(Class<?> entityClass) {
        EntityMetadata metadata = getClassMetadata(entityClass);
        if (metadata.isEmbeddable()) {
            throw new MappingException(entityClass.getName() + " is embeddable and cannot be persisted on its own");
        }
        return metadata;
    }
}
