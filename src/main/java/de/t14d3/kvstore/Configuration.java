package de.t14d3.kvstore;

import de.t14d3.kvstore.id.EncodedKeyIdConverter;
import de.t14d3.kvstore.id.IdConverter;
import de.t14d3.kvstore.id.NullIdConverter;

import java.util.Objects;
import java.util.Properties;

/**
 * Settings shared by the unit of work and the bundled storage drivers.
 * <p>
 * Can be built fluently or read from {@link Properties}:
 * <pre>
 * kvstore.id-converter=encoded
 * kvstore.id-converter.key-attribute=_key
 * kvstore.id-converter.separator=:
 * kvstore.jdbc.table-prefix=kv_
 * </pre>
 */
public class Configuration {
    public static final String ID_CONVERTER = "kvstore.id-converter";
    public static final String ID_CONVERTER_KEY_ATTRIBUTE = "kvstore.id-converter.key-attribute";
    public static final String ID_CONVERTER_SEPARATOR = "kvstore.id-converter.separator";
    public static final String JDBC_TABLE_PREFIX = "kvstore.jdbc.table-prefix";

    public static final String DEFAULT_TABLE_PREFIX = "kv_";

    private IdConverter idConverter = new NullIdConverter();
    private String tablePrefix = DEFAULT_TABLE_PREFIX;

    /**
     * Reads a configuration from properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException for an unknown id converter name
     */
    public static Configuration fromProperties(Properties properties) {
        Configuration config = new Configuration();

        String converter = properties.getProperty(ID_CONVERTER, "null").trim().toLowerCase();
        switch (converter) {
            case "null", "none", "" -> config.withIdConverter(new NullIdConverter());
            case "encoded" -> config.withIdConverter(new EncodedKeyIdConverter(
                    properties.getProperty(ID_CONVERTER_KEY_ATTRIBUTE, EncodedKeyIdConverter.DEFAULT_KEY_ATTRIBUTE),
                    properties.getProperty(ID_CONVERTER_SEPARATOR, EncodedKeyIdConverter.DEFAULT_SEPARATOR)));
            default -> throw new IllegalArgumentException("Unknown id converter: " + converter);
        }

        config.withTablePrefix(properties.getProperty(JDBC_TABLE_PREFIX, DEFAULT_TABLE_PREFIX));
        return config;
    }

    public IdConverter getIdConverter() {
        return idConverter;
    }

    public Configuration withIdConverter(IdConverter idConverter) {
        this.idConverter = Objects.requireNonNull(idConverter, "idConverter");
        return this;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public Configuration withTablePrefix(String tablePrefix) {
        this.tablePrefix = Objects.requireNonNull(tablePrefix, "tablePrefix");
        return this;
    }
}
