package de.t14d3.kvstore.storage;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * SQL database dialects for identifier quoting and column types used by {@link JdbcStorage}.
 */
public enum Dialect {
    GENERIC,
    MYSQL,
    POSTGRESQL,
    SQLITE,
    H2;

    /**
     * Quote an identifier based on the dialect.
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.trim().isEmpty()) {
            return identifier;
        }

        return switch (this) {
            case MYSQL -> "`" + identifier.replace("`", "``") + "`";
            case POSTGRESQL, SQLITE -> "\"" + identifier.replace("\"", "\"\"") + "\"";
            case H2 -> ("\"" + identifier.replace("\"", "\"\"") + "\"").toUpperCase();
            default -> identifier;
        };
    }

    /**
     * Column type able to hold a JSON document of arbitrary length.
     */
    public String documentType() {
        return switch (this) {
            case H2, GENERIC -> "CLOB";
            case MYSQL -> "LONGTEXT";
            case POSTGRESQL, SQLITE -> "TEXT";
        };
    }

    /**
     * Detect dialect from JDBC URL.
     */
    public static Dialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) return GENERIC;

        String lowerUrl = jdbcUrl.toLowerCase();
        if (lowerUrl.contains("mysql")) return MYSQL;
        if (lowerUrl.contains("postgresql") || lowerUrl.contains("postgres")) return POSTGRESQL;
        if (lowerUrl.contains("sqlite")) return SQLITE;
        if (lowerUrl.contains("h2")) return H2;

        return GENERIC;
    }

    /**
     * Detect the dialect from a database connection, falling back to {@link #GENERIC}.
     */
    public static Dialect detect(Connection connection) {
        try {
            String productName = connection.getMetaData().getDatabaseProductName().toLowerCase();
            if (productName.contains("mysql")) {
                return MYSQL;
            } else if (productName.contains("postgresql")) {
                return POSTGRESQL;
            } else if (productName.contains("sqlite")) {
                return SQLITE;
            } else if (productName.contains("h2")) {
                return H2;
            }
        } catch (SQLException e) {
            return GENERIC;
        }
        return GENERIC;
    }
}
