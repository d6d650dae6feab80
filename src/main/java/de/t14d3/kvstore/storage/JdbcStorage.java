package de.t14d3.kvstore.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.t14d3.kvstore.Configuration;
import de.t14d3.kvstore.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Stores each record as a JSON document in a relational table, one table per storage name.
 * <p>
 * Tables are created on first use with two columns: {@code id} holding the key and
 * {@code data} holding the document. Composite keys are stored as a JSON array of their
 * component values. Record values must be JSON compatible; integral numbers come back
 * as {@link Long} and {@code java.time} values as ISO-8601 strings.
 */
public final class JdbcStorage implements Storage, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcStorage.class);
    private static final Pattern STORAGE_NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final Connection connection;
    private final Dialect dialect;
    private final String tablePrefix;
    private final boolean ownsConnection;
    private final ObjectMapper mapper;
    private final Set<String> ensuredTables = new HashSet<>();

    public JdbcStorage(Connection connection, Dialect dialect, String tablePrefix) {
        this(connection, dialect, tablePrefix, false);
    }

    private JdbcStorage(Connection connection, Dialect dialect, String tablePrefix, boolean ownsConnection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.tablePrefix = Objects.requireNonNull(tablePrefix, "tablePrefix");
        this.ownsConnection = ownsConnection;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.USE_LONG_FOR_INTS);
    }

    /**
     * Opens a connection for the given URL. The storage closes it on {@link #close()}.
     */
    public static JdbcStorage create(String jdbcUrl, Configuration configuration) {
        try {
            Connection connection = DriverManager.getConnection(jdbcUrl);
            return new JdbcStorage(connection, Dialect.detectFromUrl(jdbcUrl), configuration.getTablePrefix(), true);
        } catch (SQLException e) {
            throw new StorageException("Failed to open connection to " + jdbcUrl, e);
        }
    }

    /**
     * Wraps an existing connection, which stays owned by the caller.
     */
    public static JdbcStorage create(Connection connection, Configuration configuration) {
        return new JdbcStorage(connection, Dialect.detect(connection), configuration.getTablePrefix(), false);
    }

    @Override
    public boolean supportsPartialUpdates() {
        return false;
    }

    @Override
    public boolean supportsCompositePrimaryKeys() {
        return true;
    }

    @Override
    public boolean requiresCompositePrimaryKeys() {
        return false;
    }

    @Override
    public void insert(String storageName, Object key, Map<String, Object> data) {
        String table = ensureTable(storageName);
        String sql = "INSERT INTO " + table + " (" + dialect.quoteIdentifier("id") + ", "
                + dialect.quoteIdentifier("data") + ") VALUES (?, ?)";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, encodeKey(key));
            ps.setString(2, encodeRecord(data));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to insert " + key + " into " + storageName, e);
        }
    }

    @Override
    public void update(String storageName, Object key, Map<String, Object> data) {
        String table = ensureTable(storageName);
        String sql = "UPDATE " + table + " SET " + dialect.quoteIdentifier("data") + " = ? WHERE "
                + dialect.quoteIdentifier("id") + " = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, encodeRecord(data));
            ps.setString(2, encodeKey(key));
            if (ps.executeUpdate() == 0) {
                throw new StorageException("No record " + key + " to update in " + storageName);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to update " + key + " in " + storageName, e);
        }
    }

    @Override
    public void delete(String storageName, Object key) {
        String table = ensureTable(storageName);
        String sql = "DELETE FROM " + table + " WHERE " + dialect.quoteIdentifier("id") + " = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, encodeKey(key));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete " + key + " from " + storageName, e);
        }
    }

    @Override
    public Optional<Map<String, Object>> find(String storageName, Object key) {
        String table = ensureTable(storageName);
        String sql = "SELECT " + dialect.quoteIdentifier("data") + " FROM " + table + " WHERE "
                + dialect.quoteIdentifier("id") + " = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, encodeKey(key));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(decodeRecord(rs.getString(1)));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to find " + key + " in " + storageName, e);
        }
    }

    @Override
    public String getName() {
        return "jdbc";
    }

    public Connection getConnection() {
        return connection;
    }

    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public void close() {
        if (!ownsConnection) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StorageException("Failed to close connection", e);
        }
    }

    private String ensureTable(String storageName) {
        if (storageName == null || !STORAGE_NAME.matcher(storageName).matches()) {
            throw new StorageException("Invalid storage name: " + storageName);
        }
        String table = dialect.quoteIdentifier(tablePrefix + storageName);
        if (ensuredTables.contains(storageName)) {
            return table;
        }

        String sql = "CREATE TABLE IF NOT EXISTS " + table + " (" +
                dialect.quoteIdentifier("id") + " VARCHAR(255) NOT NULL PRIMARY KEY, " +
                dialect.quoteIdentifier("data") + " " + dialect.documentType() + " NOT NULL" +
                ")";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.execute();
        } catch (SQLException e) {
            throw new StorageException("Failed to ensure table for storage " + storageName + " exists", e);
        }
        ensuredTables.add(storageName);
        log.info("Using table {} for storage '{}'", table, storageName);
        return table;
    }

    private String encodeKey(Object key) {
        if (key == null) {
            throw new StorageException("Key must not be null");
        }
        if (key instanceof Map<?, ?> map) {
            try {
                return mapper.writeValueAsString(new ArrayList<>(map.values()));
            } catch (JsonProcessingException e) {
                throw new StorageException("Cannot encode composite key " + key, e);
            }
        }
        return String.valueOf(key);
    }

    private String encodeRecord(Map<String, Object> data) {
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot encode record as JSON", e);
        }
    }

    private Map<String, Object> decodeRecord(String json) {
        try {
            return mapper.readValue(json, RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored record is not valid JSON", e);
        }
    }
}
