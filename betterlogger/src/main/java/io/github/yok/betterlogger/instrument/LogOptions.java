package io.github.yok.betterlogger.instrument;

import io.github.yok.betterlogger.LogLevel;
import io.github.yok.betterlogger.config.LoggerConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Per-instrumentation switches. Defaults come from {@link LoggerConfig}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class LogOptions {

    // Level of the entry, argument, duration and return-value records
    @Builder.Default
    String logLevel = LogLevel.INFO;

    boolean includeDuration;

    boolean includeTraceback;

    boolean includeFunctionArgs;

    boolean includeDatabase;

    // Reserved for AI input/output logging; only sets the logger's flag
    boolean includeAi;

    /**
     * Returns options initialized from a logger configuration.
     *
     * @param config logger configuration
     * @return options with level {@code INFO} and AI logging off
     */
    public static LogOptions defaultsFrom(LoggerConfig config) {
        return LogOptions.builder()
                .includeDuration(config.isIncludeDuration())
                .includeTraceback(config.isIncludeTraceback())
                .includeFunctionArgs(config.isIncludeFunctionArgs())
                .includeDatabase(config.isIncludeDatabase())
                .build();
    }
}
