package io.github.yok.betterlogger.db;

import io.github.yok.betterlogger.db.mysql.MySqlDialect;
import io.github.yok.betterlogger.db.sqlserver.SqlServerDialect;
import lombok.Generated;

/**
 * Factory that returns the {@link DatabaseDialect} for a configured database type tag.
 *
 * <ul>
 * <li>{@code mssql}: {@link SqlServerDialect}</li>
 * <li>{@code mysql}: {@link MySqlDialect}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DatabaseDialectFactory {

    private static final DatabaseDialect SQLSERVER = new SqlServerDialect();
    private static final DatabaseDialect MYSQL = new MySqlDialect();

    @Generated
    private DatabaseDialectFactory() {}

    /**
     * Returns the dialect for a database type tag.
     *
     * @param databaseType tag such as {@code mssql} or {@code mysql}
     * @return dialect
     * @throws io.github.yok.betterlogger.exception.ConfigurationException if the tag is not
     *         supported
     */
    public static DatabaseDialect create(String databaseType) {
        DatabaseType type = DatabaseType.fromTag(databaseType);
        if (type == DatabaseType.MYSQL) {
            return MYSQL;
        }
        return SQLSERVER;
    }
}
