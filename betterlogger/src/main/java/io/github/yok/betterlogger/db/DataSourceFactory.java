package io.github.yok.betterlogger.db;

import io.github.yok.betterlogger.config.LoggerConfig;
import javax.sql.DataSource;

/**
 * Creates the pooled {@link DataSource} behind a {@link ConnectionManager}.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface DataSourceFactory {

    /**
     * Creates a data source for the given URL.
     *
     * @param jdbcUrl JDBC URL including credentials
     * @param config logger configuration supplying pool settings
     * @return data source
     * @throws RuntimeException if the pool cannot be started
     */
    DataSource create(String jdbcUrl, LoggerConfig config);
}
