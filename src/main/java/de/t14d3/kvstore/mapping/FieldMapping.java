package de.t14d3.kvstore.mapping;

import java.lang.reflect.Field;

/**
 * Describes a single mapped field of an entity or embeddable.
 *
 * @param name         field name, also the key used in stored records
 * @param field        the reflected field, already made accessible
 * @param kind         how the field is persisted
 * @param embeddedType target class for {@link FieldKind#EMBEDDED} fields, otherwise {@code null}
 * @param identifier   whether the field is part of the identifier
 */
public record FieldMapping(String name, Field field, FieldKind kind, Class<?> embeddedType, boolean identifier) {

    public boolean isEmbedded() {
        return kind == FieldKind.EMBEDDED;
    }

    public boolean isTransient() {
        return kind == FieldKind.TRANSIENT;
    }

    public Class<?> type() {
        return field.getType();
    }
}
