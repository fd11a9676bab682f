package io.github.yok.betterlogger.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.betterlogger.config.LoggerConfig;
import javax.sql.DataSource;

/**
 * {@link DataSourceFactory} backed by HikariCP.
 *
 * <p>
 * The pool opens its first connection while being constructed, so unreachable servers and bad
 * logins fail here. Pooled connections are checked for liveness before being handed out.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class HikariDataSourceFactory implements DataSourceFactory {

    @Override
    public DataSource create(String jdbcUrl, LoggerConfig config) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(jdbcUrl);
        hc.setPoolName("betterlogger-" + config.getLogFileName());
        hc.setMaximumPoolSize(config.getMaximumPoolSize());
        hc.setMinimumIdle(0);
        hc.setConnectionTimeout(config.getConnectionTimeoutMillis());
        hc.setInitializationFailTimeout(1);
        hc.setAutoCommit(true);
        return new HikariDataSource(hc);
    }
}
