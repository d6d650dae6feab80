package de.t14d3.kvstore.mapping;

import de.t14d3.kvstore.annotations.Embeddable;
import de.t14d3.kvstore.annotations.Embedded;
import de.t14d3.kvstore.annotations.Entity;
import de.t14d3.kvstore.annotations.Id;
import de.t14d3.kvstore.annotations.Transient;
import de.t14d3.kvstore.exceptions.MappingException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds metadata information about an entity or embeddable class using reflection.
 */
public class EntityMetadata {
    private static final Map<Class<?>, EntityMetadata> METADATA_CACHE = new ConcurrentHashMap<>();

    private final Class<?> entityClass;
    private final String storageName;
    private final boolean embeddable;
    private final List<String> identifier;
    private final List<FieldMapping> fields;
    private final Map<String, FieldMapping> fieldsByName;

    private EntityMetadata(Class<?> entityClass) {
        this.entityClass = entityClass;

        Entity entityAnnotation = entityClass.getAnnotation(Entity.class);
        this.embeddable = entityClass.isAnnotationPresent(Embeddable.class);
        if (entityAnnotation == null && !embeddable) {
            throw new MappingException(entityClass.getName() + " is not a valid key-value-store entity");
        }

        if (embeddable) {
            this.storageName = null;
        } else if (entityAnnotation.storageName().isEmpty()) {
            this.storageName = entityClass.getSimpleName().toLowerCase();
        } else {
            this.storageName = entityAnnotation.storageName();
        }

        List<String> idFields = new ArrayList<>();
        List<FieldMapping> mappings = new ArrayList<>();
        for (Field field : entityClass.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                continue;
            }
            field.setAccessible(true);

            if (field.isAnnotationPresent(Id.class)) {
                idFields.add(field.getName());
                mappings.add(new FieldMapping(field.getName(), field, FieldKind.PLAIN, null, true));
            } else if (field.isAnnotationPresent(Transient.class) || Modifier.isTransient(field.getModifiers())) {
                mappings.add(new FieldMapping(field.getName(), field, FieldKind.TRANSIENT, null, false));
            } else if (field.isAnnotationPresent(Embedded.class)) {
                Class<?> target = field.getAnnotation(Embedded.class).target();
                if (target == void.class) {
                    target = field.getType();
                }
                if (!target.isAnnotationPresent(Embeddable.class)) {
                    throw new MappingException("Embedded field " + entityClass.getName() + "#" + field.getName()
                            + " targets " + target.getName() + " which is not annotated with @Embeddable");
                }
                mappings.add(new FieldMapping(field.getName(), field, FieldKind.EMBEDDED, target, false));
            } else {
                mappings.add(new FieldMapping(field.getName(), field, FieldKind.PLAIN, null, false));
            }
        }

        if (!embeddable && idFields.isEmpty()) {
            throw new MappingException("Entity " + entityClass.getName() + " must have a field annotated with @Id");
        }

        this.identifier = List.copyOf(idFields);
        this.fields = List.copyOf(mappings);
        Map<String, FieldMapping> byName = new LinkedHashMap<>();
        for (FieldMapping mapping : mappings) {
            byName.put(mapping.name(), mapping);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Get or create metadata for the given entity class.
     */
    public static EntityMetadata of(Class<?> entityClass) {
        return METADATA_CACHE.computeIfAbsent(entityClass, EntityMetadata::new);
    }

    /**
     * Fully qualified class name; the identity map is partitioned by it.
     */
    public String getName() {
        return entityClass.getName();
    }

    public String getStorageName() {
        return storageName;
    }

    public boolean isEmbeddable() {
        return embeddable;
    }

    /**
     * Identifier field names in declaration order.
     */
    public List<String> getIdentifier() {
        return identifier;
    }

    public boolean isCompositeKey() {
        return identifier.size() > 1;
    }

    public boolean isIdentifier(String fieldName) {
        return identifier.contains(fieldName);
    }

    public List<FieldMapping> getFields() {
        return fields;
    }

    public FieldMapping getField(String name) {
        return fieldsByName.get(name);
    }

    public boolean hasField(String name) {
        return fieldsByName.containsKey(name);
    }

    /**
     * Reads all identifier fields off an instance, keyed by field name in declaration order.
     * Unset fields map to {@code null}.
     */
    public Map<String, Object> getIdentifierValues(Object entity) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String name : identifier) {
            values.put(name, getFieldValue(entity, fieldsByName.get(name)));
        }
        return values;
    }

    /**
     * Gets the value of a field from an entity instance.
     */
    public Object getFieldValue(Object entity, FieldMapping mapping) {
        try {
            return mapping.field().get(entity);
        } catch (IllegalAccessException e) {
            throw new MappingException("Cannot access field " + mapping.name(), e);
        }
    }

    /**
     * Sets the value of a field on an entity instance, coercing it to the field type first.
     */
    public void setFieldValue(Object entity, FieldMapping mapping, Object value) {
        Object converted = TypeMapper.convertToJavaType(value, mapping.type());
        if (converted == null && mapping.type().isPrimitive()) {
            return;
        }
        try {
            mapping.field().set(entity, converted);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new MappingException("Cannot set field " + mapping.name() + " of " + getName(), e);
        }
    }

    /**
     * Creates a new, blank instance of the class.
     */
    public Object newInstance() {
        Constructor<?> constructor;
        try {
            constructor = entityClass.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new MappingException("Cannot find parameterless constructor for " + entityClass.getName(), e);
        }

        try {
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new MappingException("Cannot instantiate " + entityClass.getName(), e);
        }
    }
}
