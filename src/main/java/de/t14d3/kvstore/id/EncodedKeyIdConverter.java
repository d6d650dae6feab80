package de.t14d3.kvstore.id;

import de.t14d3.kvstore.exceptions.InvalidIdentifierException;
import de.t14d3.kvstore.mapping.EntityMetadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Encodes composite identifiers into a single string key, for storages that address
 * records by one string only.
 * <p>
 * Components are joined in identifier declaration order, so {@code {tenant: "acme", no: 7}}
 * becomes {@code "acme:7"} with the default separator. Records may carry the encoded key
 * under {@link #getKeyAttribute()}; {@link #unserialize} strips that attribute and restores
 * the identifier fields from it.
 */
public class EncodedKeyIdConverter implements IdConverter {
    public static final String DEFAULT_KEY_ATTRIBUTE = "_key";
    public static final String DEFAULT_SEPARATOR = ":";

    private final String keyAttribute;
    private final String separator;

    public EncodedKeyIdConverter() {
        this(DEFAULT_KEY_ATTRIBUTE, DEFAULT_SEPARATOR);
    }

    public EncodedKeyIdConverter(String keyAttribute, String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        this.keyAttribute = keyAttribute;
        this.separator = separator;
    }

    public String getKeyAttribute() {
        return keyAttribute;
    }

    public String getSeparator() {
        return separator;
    }

    @Override
    public Object serialize(EntityMetadata metadata, Object id) {
        if (!(id instanceof Map<?, ?> map)) {
            return id;
        }
        StringJoiner joiner = new StringJoiner(separator);
        for (String field : metadata.getIdentifier()) {
            Object component = map.get(field);
            if (component == null) {
                throw new InvalidIdentifierException("Missing identifier field " + field + " of " + metadata.getName());
            }
            String text = component.toString();
            if (text.contains(separator)) {
                throw new InvalidIdentifierException("Identifier component " + field + "='" + text
                        + "' contains the key separator '" + separator + "'");
            }
            joiner.add(text);
        }
        return joiner.toString();
    }

    @Override
    public Map<String, Object> unserialize(EntityMetadata metadata, Map<String, Object> data) {
        Map<String, Object> cleaned = new LinkedHashMap<>(data);
        Object encoded = cleaned.remove(keyAttribute);
        if (encoded instanceof String key && !metadata.getIdentifier().isEmpty()) {
            for (Map.Entry<String, Object> component : decode(metadata, key).entrySet()) {
                if (cleaned.get(component.getKey()) == null) {
                    cleaned.put(component.getKey(), component.getValue());
                }
            }
        }
        return cleaned;
    }

    /**
     * Splits an encoded key back into its identifier components, as strings.
     */
    public Map<String, Object> decode(EntityMetadata metadata, String encoded) {
        List<String> fields = metadata.getIdentifier();
        String[] parts = encoded.split(Pattern.quote(separator), -1);
        if (parts.length != fields.size()) {
            throw new InvalidIdentifierException("Encoded key '" + encoded + "' has " + parts.length
                    + " components but " + metadata.getName() + " declares " + fields.size());
        }
        Map<String, Object> id = new LinkedHashMap<>();
        for (int i = 0; i < parts.length; i++) {
            id.put(fields.get(i), parts[i]);
        }
        return id;
    }
}
