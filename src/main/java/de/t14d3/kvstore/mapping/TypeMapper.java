package de.t14d3.kvstore.mapping;

import de.t14d3.kvstore.exceptions.MappingException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Converts values read from a storage record into the declared Java type of a field.
 * <p>
 * Storage drivers hand back whatever their wire format produced (JSON numbers as
 * {@code Long}, encoded keys as {@code String}, ...); assignment goes through here.
 */
public class TypeMapper {

    /**
     * Convert a storage value to the target Java type.
     * Handles type coercion where appropriate (e.g., Number -> int, long, float, double).
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Object convertToJavaType(Object value, Class<?> targetType) {
        if (value == null) return null;
        if (targetType.isInstance(value)) return value;

        try {
            if (targetType == Long.class || targetType == long.class) {
                if (value instanceof Number n) return n.longValue();
                if (value instanceof String s) return Long.parseLong(s);
            } else if (targetType == Integer.class || targetType == int.class) {
                if (value instanceof Number n) return n.intValue();
                if (value instanceof String s) return Integer.parseInt(s);
            } else if (targetType == Double.class || targetType == double.class) {
                if (value instanceof Number n) return n.doubleValue();
                if (value instanceof String s) return Double.parseDouble(s);
            } else if (targetType == Float.class || targetType == float.class) {
                if (value instanceof Number n) return n.floatValue();
                if (value instanceof String s) return Float.parseFloat(s);
            } else if (targetType == Short.class || targetType == short.class) {
                if (value instanceof Number n) return n.shortValue();
                if (value instanceof String s) return Short.parseShort(s);
            } else if (targetType == Byte.class || targetType == byte.class) {
                if (value instanceof Number n) return n.byteValue();
                if (value instanceof String s) return Byte.parseByte(s);
            } else if (targetType == UUID.class) {
                if (value instanceof String s) return UUID.fromString(s);
            } else if (targetType == String.class) {
                return value.toString();
            } else if (targetType == Boolean.class || targetType == boolean.class) {
                if (value instanceof Number n) return n.intValue() != 0;
                return Boolean.parseBoolean(value.toString());
            } else if (targetType == BigDecimal.class) {
                if (value instanceof Number n) return new BigDecimal(n.toString());
                if (value instanceof String s) return new BigDecimal(s);
            } else if (targetType == LocalDate.class) {
                if (value instanceof String s) return LocalDate.parse(s);
            } else if (targetType == LocalDateTime.class) {
                if (value instanceof String s) return LocalDateTime.parse(s);
            } else if (targetType == Instant.class) {
                if (value instanceof String s) return Instant.parse(s);
                if (value instanceof Number n) return Instant.ofEpochMilli(n.longValue());
            } else if (targetType.isEnum()) {
                if (value instanceof String s) return Enum.valueOf((Class<? extends Enum>) targetType, s);
            }
        } catch (RuntimeException e) {
            throw new MappingException("Cannot convert '" + value + "' to " + targetType.getName(), e);
        }

        // Types we don't explicitly handle (collections, custom types) are returned as-is
        // and left to the reflective assignment to accept or reject.
        return value;
    }
}
