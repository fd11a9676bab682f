package io.github.yok.betterlogger.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the {@code betterlogger.*} section of {@code application.yml}.
 *
 * <pre>
 * betterlogger:
 *   log-file-name: System
 *   log-dir: logs
 *   log-to-console: false
 *   include-database: true
 *   database:
 *     type: mysql
 *     server: localhost:3306
 *     name: appdb
 *     username: app
 *     password: secret
 *   table:
 *     table-name: AppLogs
 *     create-table-if-not-exists: true
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "betterlogger")
@Data
public class BetterLoggerProperties {

    private String logFileName = "System";
    private String logDir = "logs";
    private boolean logToConsole;
    private boolean includeDuration = true;
    private boolean includeTraceback = true;
    private boolean includeFunctionArgs = true;
    private boolean includeDatabase;
    private Database database = new Database();
    private Table table = new Table();

    /**
     * Database connection settings.
     */
    @Data
    public static class Database {
        // mssql or mysql
        private String type = "mssql";
        private String server;
        private String name;
        private String username;
        @ToString.Exclude
        private String password;
        // Extra driver properties (e.g., trustServerCertificate: true)
        private Map<String, String> properties = new LinkedHashMap<>();
        private long connectionTimeoutMillis = 30_000L;
        private int maximumPoolSize = 2;
    }

    /**
     * Log table settings.
     */
    @Data
    public static class Table {
        private String tableName;
        private boolean createTableIfNotExists;
    }

    /**
     * Converts the bound properties into an immutable {@link LoggerConfig}.
     *
     * @return logger configuration
     */
    public LoggerConfig toLoggerConfig() {
        DatabaseCredentials credentials = DatabaseCredentials.builder()
                .server(database.getServer())
                .name(database.getName())
                .username(database.getUsername())
                .password(database.getPassword())
                .build();
        return LoggerConfig.builder()
                .logFileName(logFileName)
                .logDir(logDir)
                .logToConsole(logToConsole)
                .includeDuration(includeDuration)
                .includeTraceback(includeTraceback)
                .includeFunctionArgs(includeFunctionArgs)
                .includeDatabase(includeDatabase)
                .database(credentials)
                .databaseType(database.getType())
                .connectionProperties(Map.copyOf(database.getProperties()))
                .connectionTimeoutMillis(database.getConnectionTimeoutMillis())
                .maximumPoolSize(database.getMaximumPoolSize())
                .table(TableDescriptor.of(table.getTableName(), table.isCreateTableIfNotExists()))
                .build();
    }
}
