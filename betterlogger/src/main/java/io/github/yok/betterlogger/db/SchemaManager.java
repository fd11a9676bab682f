package io.github.yok.betterlogger.db;

import com.google.common.base.Preconditions;
import io.github.yok.betterlogger.config.TableDescriptor;
import io.github.yok.betterlogger.exception.ConfigurationException;
import io.github.yok.betterlogger.exception.SchemaException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Creates the log table when it does not exist.
 *
 * <p>
 * The DDL is idempotent: SQL Server guards {@code CREATE TABLE} with an {@code OBJECT_ID} check and
 * MySQL uses {@code CREATE TABLE IF NOT EXISTS}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaManager {

    private final ConnectionManager connectionManager;

    /**
     * Creates a schema manager.
     *
     * @param connectionManager source of connections and dialect
     */
    public SchemaManager(ConnectionManager connectionManager) {
        this.connectionManager =
                Preconditions.checkNotNull(connectionManager, "connectionManager must not be null");
    }

    /**
     * Ensures the table described by {@code descriptor} exists.
     *
     * @param descriptor table descriptor
     * @throws ConfigurationException if the table name is blank
     * @throws SchemaException if the DDL fails
     */
    public void ensureTable(TableDescriptor descriptor) {
        Preconditions.checkNotNull(descriptor, "descriptor must not be null");
        String tableName = descriptor.getTableName();
        if (StringUtils.isBlank(tableName)) {
            throw new ConfigurationException("Table name is required to create the log table.");
        }
        String ddl = connectionManager.getDialect().createTableIfNotExistsSql(tableName);
        log.debug("Ensuring log table. table={}, ddl={}", tableName, ddl);
        try (Connection connection = connectionManager.getConnection().getConnection();
                Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            log.error("Failed to ensure log table. table={}", tableName, e);
            throw new SchemaException(tableName, e);
        }
    }
}
