package de.t14d3.kvstore.core;

import de.t14d3.kvstore.exceptions.MappingException;
import de.t14d3.kvstore.mapping.EntityMetadata;
import de.t14d3.kvstore.mapping.ExtraAttributes;
import de.t14d3.kvstore.mapping.FieldMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiFunction;

/**
 * Converts between live instances and flat field maps.
 * <p>
 * {@link #snapshot} is free of side effects: it never touches tracking state, so the
 * unit of work can call it as often as it needs to diff. Mutable values (collections,
 * dates, arrays) are copied in both directions, so later in-place changes on the
 * instance show up as differences.
 */
public class ObjectSnapshotter {
    private static final Logger log = LoggerFactory.getLogger(ObjectSnapshotter.class);

    /**
     * Builds the field map of an instance: every mapped field except identifier and
     * transient fields, embedded instances as nested maps, then any extra attributes.
     * A {@code null} instance yields an empty map.
     */
    public Map<String, Object> snapshot(EntityMetadata metadata, Object instance) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (instance == null) {
            return data;
        }

        for (FieldMapping mapping : metadata.getFields()) {
            if (metadata.isIdentifier(mapping.name()) || mapping.isTransient()) {
                continue;
            }
            Object value = metadata.getFieldValue(instance, mapping);
            if (mapping.isEmbedded()) {
                data.put(mapping.name(), snapshot(EntityMetadata.of(mapping.embeddedType()), value));
            } else {
                data.put(mapping.name(), copyValue(value));
            }
        }

        if (instance instanceof ExtraAttributes extra) {
            for (Map.Entry<String, Object> attribute : extra.getExtraAttributes().entrySet()) {
                if (!data.containsKey(attribute.getKey()) && !metadata.hasField(attribute.getKey())) {
                    data.put(attribute.getKey(), copyValue(attribute.getValue()));
                }
            }
        }
        return data;
    }

    /**
     * Assigns a record to an instance. Nested maps of embedded fields are turned into
     * instances by {@code embeddedFactory}; keys without a declared field go to the
     * instance's extra attributes, or are dropped if it has none.
     */
    public void hydrate(EntityMetadata metadata, Object instance, Map<String, Object> data,
                        BiFunction<EntityMetadata, Map<String, Object>, Object> embeddedFactory) {
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            FieldMapping mapping = metadata.getField(name);

            if (mapping == null) {
                if (instance instanceof ExtraAttributes extra) {
                    extra.getExtraAttributes().put(name, copyValue(value));
                } else {
                    log.debug("Dropping undeclared attribute '{}' of {}", name, metadata.getName());
                }
                continue;
            }

            switch (mapping.kind()) {
                case TRANSIENT -> {
                }
                case EMBEDDED -> metadata.setFieldValue(instance, mapping,
                        toEmbedded(metadata, mapping, value, embeddedFactory));
                case PLAIN -> metadata.setFieldValue(instance, mapping, copyValue(value));
            }
        }
    }

    private Object toEmbedded(EntityMetadata owner, FieldMapping mapping, Object value,
                              BiFunction<EntityMetadata, Map<String, Object>, Object> embeddedFactory) {
        if (value == null || mapping.embeddedType().isInstance(value)) {
            return value;
        }
        if (!(value instanceof Map<?, ?> nested)) {
            throw new MappingException("Embedded field " + owner.getName() + "#" + mapping.name()
                    + " expects a map but the record holds " + value.getClass().getName());
        }
        // an empty nested map is how a null embedded instance is stored
        if (nested.isEmpty()) {
            return null;
        }
        Map<String, Object> nestedData = new LinkedHashMap<>();
        nested.forEach((k, v) -> nestedData.put(String.valueOf(k), v));
        return embeddedFactory.apply(EntityMetadata.of(mapping.embeddedType()), nestedData);
    }

    @SuppressWarnings("IfCanBeSwitch")
    static Object copyValue(Object v) {
        if (v == null) return null;
        if (v instanceof Date d) return d.clone();
        if (v instanceof byte[] bytes) return Arrays.copyOf(bytes, bytes.length);
        if (v instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(e -> copy.add(copyValue(e)));
            return copy;
        }
        if (v instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(e -> copy.add(copyValue(e)));
            return copy;
        }
        if (v instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, e) -> copy.put(k, copyValue(e)));
            return copy;
        }
        return v;
    }
}
