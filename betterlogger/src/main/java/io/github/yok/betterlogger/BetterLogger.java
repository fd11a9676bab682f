package io.github.yok.betterlogger;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import io.github.yok.betterlogger.config.LoggerConfig;
import io.github.yok.betterlogger.db.ConnectionManager;
import io.github.yok.betterlogger.db.DataSourceFactory;
import io.github.yok.betterlogger.db.HikariDataSourceFactory;
import io.github.yok.betterlogger.db.SchemaManager;
import io.github.yok.betterlogger.instrument.Instrumentation;
import io.github.yok.betterlogger.instrument.LogOptions;
import io.github.yok.betterlogger.sink.DatabaseSink;
import io.github.yok.betterlogger.sink.FileSink;
import io.github.yok.betterlogger.util.TimestampFormatter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the library: writes log records and instruments function calls.
 *
 * <p>
 * {@link #logging(String, String, Path, boolean)} always appends to the log file and, when asked,
 * also inserts a row through the database sink. Both writes share one timestamp. They are not
 * atomic: when the database write fails, the file line has already been written and the failure
 * propagates to the caller.
 * </p>
 *
 * <p>
 * One instance is meant to be long-lived and shared by every instrumented function. The database
 * connection pool is created lazily on the first database write and released by {@link #close()}.
 * </p>
 *
 * <pre>
 * BetterLogger logger = new BetterLogger(LoggerConfig.builder().logFileName("App").build());
 * CheckedBiFunction&lt;Integer, Integer, Integer, RuntimeException&gt; add =
 *         logger.log().wrap("add", (Integer a, Integer b) -&gt; a + b);
 * add.apply(5, 3);
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BetterLogger implements AutoCloseable {

    private final LoggerConfig config;
    private final TimestampFormatter timestampFormatter;
    private final Ticker ticker;
    private final FileSink fileSink;
    private final ConnectionManager connectionManager;
    private final DatabaseSink databaseSink;
    private volatile boolean aiLoggingEnabled;

    /**
     * Creates a logger with the system clock, console echo on {@code System.out} and a HikariCP
     * connection pool.
     *
     * @param config logger configuration
     */
    public BetterLogger(LoggerConfig config) {
        this(config, new TimestampFormatter(), Ticker.systemTicker(),
                new FileSink(config.isLogToConsole()), new HikariDataSourceFactory());
    }

    /**
     * Creates a logger with explicit collaborators.
     *
     * <p>
     * The log directory is created when it does not exist.
     * </p>
     *
     * @param config logger configuration
     * @param timestampFormatter source and format of record timestamps
     * @param ticker time source for call durations
     * @param fileSink file sink
     * @param dataSourceFactory factory for the database connection pool
     * @throws UncheckedIOException if the log directory cannot be created
     */
    public BetterLogger(LoggerConfig config, TimestampFormatter timestampFormatter, Ticker ticker,
            FileSink fileSink, DataSourceFactory dataSourceFactory) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.timestampFormatter = Preconditions.checkNotNull(timestampFormatter,
                "timestampFormatter must not be null");
        this.ticker = Preconditions.checkNotNull(ticker, "ticker must not be null");
        this.fileSink = Preconditions.checkNotNull(fileSink, "fileSink must not be null");
        this.connectionManager = new ConnectionManager(config, dataSourceFactory);
        this.databaseSink = new DatabaseSink(connectionManager,
                new SchemaManager(connectionManager), config.getTable(), fileSink,
                timestampFormatter, config.getLogFilePath());

        Path logDir = Paths.get(config.getLogDir());
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create log directory: " + logDir, e);
        }
        log.debug("BetterLogger initialized. logFile={}", config.getLogFilePath());
    }

    /**
     * Writes an INFO record to the default log file.
     *
     * @param message message text
     */
    public void logging(String message) {
        logging(message, LogLevel.INFO, null, false);
    }

    /**
     * Writes a record to the default log file.
     *
     * @param message message text
     * @param level level label
     */
    public void logging(String message, String level) {
        logging(message, level, null, false);
    }

    /**
     * Writes a record to the default log file and, optionally, the database.
     *
     * @param message message text
     * @param level level label
     * @param includeDatabase whether the record is also inserted into the database table
     */
    public void logging(String message, String level, boolean includeDatabase) {
        logging(message, level, null, includeDatabase);
    }

    /**
     * Writes a record to a log file and, optionally, the database.
     *
     * @param message message text
     * @param level level label
     * @param filePath target file, or {@code null} for the default log file
     * @param includeDatabase whether the record is also inserted into the database table
     * @throws UncheckedIOException if the file cannot be written
     * @throws io.github.yok.betterlogger.exception.BetterLoggerException if the database write
     *         fails; the file line is written before
     */
    public void logging(String message, String level, Path filePath, boolean includeDatabase) {
        LocalDateTime time = timestampFormatter.now();
        Path target = filePath != null ? filePath : config.getLogFilePath();
        fileSink.write(message, level, timestampFormatter.format(time), target);
        if (includeDatabase) {
            databaseSink.record(message, level, time);
        }
    }

    /**
     * Returns an instrumentation using the defaults of this logger's configuration.
     *
     * @return instrumentation
     */
    public Instrumentation log() {
        return log(options().build());
    }

    /**
     * Returns an instrumentation with explicit options.
     *
     * <p>
     * {@link LogOptions#isIncludeAi()} is copied to this logger's AI-logging flag.
     * </p>
     *
     * @param options instrumentation options
     * @return instrumentation
     */
    public Instrumentation log(LogOptions options) {
        Preconditions.checkNotNull(options, "options must not be null");
        this.aiLoggingEnabled = options.isIncludeAi();
        return new Instrumentation(this, options, ticker);
    }

    /**
     * Returns an options builder pre-filled with this logger's defaults.
     *
     * @return options builder
     */
    public LogOptions.LogOptionsBuilder options() {
        return LogOptions.defaultsFrom(config).toBuilder();
    }

    /**
     * Returns whether AI input/output logging was requested by the last {@link #log(LogOptions)}.
     *
     * @return AI-logging flag
     */
    public boolean isAiLoggingEnabled() {
        return aiLoggingEnabled;
    }

    /**
     * Returns the configuration of this logger.
     *
     * @return configuration
     */
    public LoggerConfig getConfig() {
        return config;
    }

    /**
     * Releases the database connection pool, if one was created.
     */
    @Override
    public void close() {
        connectionManager.close();
    }
}
