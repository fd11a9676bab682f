package io.github.yok.betterlogger.sink;

import com.google.common.base.Preconditions;
import io.github.yok.betterlogger.LogLevel;
import io.github.yok.betterlogger.config.TableDescriptor;
import io.github.yok.betterlogger.db.ConnectionManager;
import io.github.yok.betterlogger.db.DatabaseDialect;
import io.github.yok.betterlogger.db.SchemaManager;
import io.github.yok.betterlogger.exception.BetterLoggerException;
import io.github.yok.betterlogger.exception.ConfigurationException;
import io.github.yok.betterlogger.exception.DatabaseUnavailableException;
import io.github.yok.betterlogger.exception.InsertException;
import io.github.yok.betterlogger.exception.SchemaException;
import io.github.yok.betterlogger.util.TimestampFormatter;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Writes one row per log record into the configured database table.
 *
 * <p>
 * Processing order of {@link #record(String, String, LocalDateTime)}:
 * </p>
 * <ol>
 * <li>Verify connectivity with a round-trip query. On failure an ERROR line is written to the log
 * file and {@link DatabaseUnavailableException} is thrown; nothing is inserted.</li>
 * <li>Require a table name ({@link ConfigurationException} otherwise).</li>
 * <li>Create the table when {@link TableDescriptor#isCreateTableIfNotExists()} is set.</li>
 * <li>Insert {@code (LogTime, LogLevel, LogMessage)} with bound parameters.</li>
 * </ol>
 * <p>
 * Failures in steps 3 and 4 are written to the log file as an ERROR line and then rethrown.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DatabaseSink {

    private final ConnectionManager connectionManager;
    private final SchemaManager schemaManager;
    private final TableDescriptor table;
    private final FileSink fileSink;
    private final TimestampFormatter timestampFormatter;
    private final Path errorLogPath;

    /**
     * Creates a database sink.
     *
     * @param connectionManager source of connections and dialect
     * @param schemaManager table creator
     * @param table target table
     * @param fileSink sink that receives failure reports
     * @param timestampFormatter formatter for failure report timestamps
     * @param errorLogPath file that receives failure reports
     */
    public DatabaseSink(ConnectionManager connectionManager, SchemaManager schemaManager,
            TableDescriptor table, FileSink fileSink, TimestampFormatter timestampFormatter,
            Path errorLogPath) {
        this.connectionManager = Preconditions.checkNotNull(connectionManager);
        this.schemaManager = Preconditions.checkNotNull(schemaManager);
        this.table = Preconditions.checkNotNull(table);
        this.fileSink = Preconditions.checkNotNull(fileSink);
        this.timestampFormatter = Preconditions.checkNotNull(timestampFormatter);
        this.errorLogPath = Preconditions.checkNotNull(errorLogPath);
    }

    /**
     * Inserts one log row.
     *
     * @param message message text
     * @param level level label
     * @param time record time, shared with the file line of the same call
     * @throws ConfigurationException if credentials, database type or table name are missing
     * @throws DatabaseUnavailableException if the database cannot be reached
     * @throws SchemaException if the table cannot be created
     * @throws InsertException if the row cannot be inserted
     */
    public void record(String message, String level, LocalDateTime time) {
        DatabaseDialect dialect = verifyConnectivity();
        String tableName = requireTableName();
        try {
            if (table.isCreateTableIfNotExists()) {
                schemaManager.ensureTable(table);
            }
            insert(dialect, tableName, message, level, time);
        } catch (SchemaException | InsertException e) {
            throw reportFailure("Database logging failed for table " + tableName + ": "
                    + ExceptionUtils.getRootCauseMessage(e), e);
        }
    }

    private DatabaseDialect verifyConnectivity() {
        DatabaseDialect dialect = connectionManager.getDialect();
        try (Connection connection = connectionManager.getConnection().getConnection();
                Statement statement = connection.createStatement()) {
            statement.execute(dialect.validationQuery());
            return dialect;
        } catch (DatabaseUnavailableException e) {
            throw reportFailure("Database connection failed: "
                    + ExceptionUtils.getRootCauseMessage(e), e);
        } catch (SQLException e) {
            DatabaseUnavailableException unavailable = new DatabaseUnavailableException(
                    "Database connectivity check failed: " + e.getMessage(), e);
            throw reportFailure("Database connection failed: " + e.getMessage(), unavailable);
        }
    }

    private String requireTableName() {
        String tableName = table.getTableName();
        if (StringUtils.isBlank(tableName)) {
            throw new ConfigurationException("Table name is not configured. Set the table name of "
                    + "an existing table with the columns " + DatabaseDialect.EXPECTED_COLUMNS
                    + ", or enable createTableIfNotExists.");
        }
        return tableName;
    }

    private void insert(DatabaseDialect dialect, String tableName, String message, String level,
            LocalDateTime time) {
        try (Connection connection = connectionManager.getConnection().getConnection();
                PreparedStatement ps = connection.prepareStatement(dialect.insertSql(tableName))) {
            ps.setTimestamp(1, Timestamp.valueOf(time));
            ps.setString(2, level);
            ps.setString(3, message);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to insert log record. table={}", tableName, e);
            throw new InsertException(tableName, e);
        }
    }

    /**
     * Writes an ERROR line describing {@code failure} to the log file and returns the failure so
     * the caller can rethrow it. A failing file write is attached as suppressed.
     */
    private <T extends BetterLoggerException> T reportFailure(String description, T failure) {
        try {
            fileSink.write(description, LogLevel.ERROR,
                    timestampFormatter.format(timestampFormatter.now()), errorLogPath);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
        return failure;
    }
}
