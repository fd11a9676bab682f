package io.github.yok.betterlogger.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings of one {@link io.github.yok.betterlogger.BetterLogger} instance.
 *
 * <p>
 * Database settings are only checked when a database write is attempted, so a configuration that
 * never enables {@link #includeDatabase} may leave them empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class LoggerConfig {

    /**
     * Base name of the log file; {@code .log} is appended.
     */
    @Builder.Default
    String logFileName = "System";

    /**
     * Directory that holds the log file.
     */
    @Builder.Default
    String logDir = "logs";

    /**
     * Whether every written line is also printed to the console.
     */
    boolean logToConsole;

    /**
     * Database server and login.
     */
    @Builder.Default
    DatabaseCredentials database = DatabaseCredentials.builder().build();

    /**
     * Database type tag, {@code mssql} or {@code mysql}.
     */
    @Builder.Default
    String databaseType = "mssql";

    /**
     * Extra driver properties appended to the connection URL.
     */
    @Builder.Default
    Map<String, String> connectionProperties = Map.of();

    /**
     * Default for logging the execution time of instrumented calls.
     */
    @Builder.Default
    boolean includeDuration = true;

    /**
     * Default for logging the stack trace of failed calls.
     */
    @Builder.Default
    boolean includeTraceback = true;

    /**
     * Default for logging the arguments of instrumented calls.
     */
    @Builder.Default
    boolean includeFunctionArgs = true;

    /**
     * Default for sending instrumentation records to the database sink.
     */
    boolean includeDatabase;

    /**
     * Target table of the database sink.
     */
    @Builder.Default
    TableDescriptor table = TableDescriptor.none();

    /**
     * Maximum wait for a pooled connection, in milliseconds.
     */
    @Builder.Default
    long connectionTimeoutMillis = 30_000L;

    /**
     * Maximum number of pooled connections.
     */
    @Builder.Default
    int maximumPoolSize = 2;

    /**
     * Returns the default log file, {@code <logDir>/<logFileName>.log}.
     *
     * @return log file path
     */
    public Path getLogFilePath() {
        return Paths.get(logDir, logFileName + ".log");
    }
}
