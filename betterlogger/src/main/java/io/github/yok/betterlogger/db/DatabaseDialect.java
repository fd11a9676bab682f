package io.github.yok.betterlogger.db;

import io.github.yok.betterlogger.config.DatabaseCredentials;
import java.util.Map;

/**
 * Database-specific connection URL and SQL grammar used by the database sink.
 *
 * <p>
 * Identifiers are developer-configured and interpolated after quoting. Row values are never
 * interpolated; {@link #insertSql(String)} only contains bind markers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DatabaseDialect {

    /**
     * Expected log table columns, used in configuration error messages.
     */
    String EXPECTED_COLUMNS = "LogID (auto-increment integer primary key), "
            + "LogTime (timestamp, defaults to the current time), "
            + "LogLevel (text, 50 characters), LogMessage (unbounded text)";

    /**
     * Returns the database family handled by this dialect.
     *
     * @return database type
     */
    DatabaseType getType();

    /**
     * Builds the JDBC URL, embedding the credentials with the escaping this driver expects.
     *
     * @param credentials server, database and login
     * @param properties extra driver properties, appended in iteration order
     * @return JDBC URL
     */
    String buildJdbcUrl(DatabaseCredentials credentials, Map<String, String> properties);

    /**
     * Quotes a table identifier.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns idempotent DDL that creates the four-column log table when it does not exist.
     *
     * @param tableName table name
     * @return DDL statement
     */
    String createTableIfNotExistsSql(String tableName);

    /**
     * Returns the parameterized insert for one log row; binds are LogTime, LogLevel, LogMessage.
     *
     * @param tableName table name
     * @return insert statement with three bind markers
     */
    default String insertSql(String tableName) {
        return "INSERT INTO " + quoteIdentifier(tableName)
                + " (LogTime, LogLevel, LogMessage) VALUES (?, ?, ?)";
    }

    /**
     * Returns the trivial round-trip query used to verify connectivity.
     *
     * @return validation query
     */
    default String validationQuery() {
        return "SELECT 1";
    }
}
