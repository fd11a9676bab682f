package io.github.yok.betterlogger.db;

import com.google.common.base.Preconditions;
import io.github.yok.betterlogger.config.LoggerConfig;
import io.github.yok.betterlogger.exception.ConfigurationException;
import io.github.yok.betterlogger.exception.DatabaseUnavailableException;
import io.github.yok.betterlogger.util.MaskingLogUtil;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Lazily creates and caches the single connection pool of one logger instance.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Nothing is validated or opened until {@link #getConnection()} is first called.</li>
 * <li>At most one pool is created per instance; concurrent callers wait for the first one.</li>
 * <li>A failed creation is reported and nothing is cached, so the next call tries again. There
 * is no automatic retry.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    private final LoggerConfig config;
    private final DataSourceFactory dataSourceFactory;
    private final Object lock = new Object();
    private volatile DataSource dataSource;

    /**
     * Creates a manager.
     *
     * @param config logger configuration holding credentials and database type
     * @param dataSourceFactory factory used to build the pool
     */
    public ConnectionManager(LoggerConfig config, DataSourceFactory dataSourceFactory) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.dataSourceFactory =
                Preconditions.checkNotNull(dataSourceFactory, "dataSourceFactory must not be null");
    }

    /**
     * Returns the cached pool, creating it on first use.
     *
     * @return pooled data source
     * @throws ConfigurationException if a credential is blank or the database type is unknown
     * @throws DatabaseUnavailableException if the pool cannot be created
     */
    public DataSource getConnection() {
        DataSource current = dataSource;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (dataSource != null) {
                return dataSource;
            }
            List<String> missing = config.getDatabase().missingFields();
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Database settings are incomplete; missing "
                        + String.join(", ", missing)
                        + ". Provide all of server, name, username and password,"
                        + " or disable includeDatabase.");
            }
            DatabaseDialect dialect = getDialect();
            String jdbcUrl =
                    dialect.buildJdbcUrl(config.getDatabase(), config.getConnectionProperties());
            String maskedUrl = MaskingLogUtil.maskJdbcUrl(jdbcUrl);
            log.info("Creating connection pool. type={}, url={}", dialect.getType().getTag(),
                    maskedUrl);
            try {
                dataSource = dataSourceFactory.create(jdbcUrl, config);
            } catch (RuntimeException e) {
                log.error("Failed to create connection pool. url={}", maskedUrl, e);
                throw new DatabaseUnavailableException(
                        "Failed to connect to the database: " + maskedUrl, e);
            }
            return dataSource;
        }
    }

    /**
     * Returns the dialect for the configured database type.
     *
     * @return dialect
     * @throws ConfigurationException if the database type is unknown
     */
    public DatabaseDialect getDialect() {
        return DatabaseDialectFactory.create(config.getDatabaseType());
    }

    /**
     * Returns whether a pool has been created and not yet closed.
     *
     * @return {@code true} when a pool is cached
     */
    public boolean isInitialized() {
        return dataSource != null;
    }

    /**
     * Shuts the pool down, if one was created. A later {@link #getConnection()} creates a new one.
     */
    @Override
    public void close() {
        synchronized (lock) {
            DataSource current = dataSource;
            dataSource = null;
            if (current instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) current).close();
                    log.debug("Connection pool closed.");
                } catch (Exception e) {
                    throw new IllegalStateException("Failed to close connection pool", e);
                }
            }
        }
    }
}
