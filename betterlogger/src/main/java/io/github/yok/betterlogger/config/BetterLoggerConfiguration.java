package io.github.yok.betterlogger.config;

import io.github.yok.betterlogger.BetterLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes a shared {@link BetterLogger} built from {@link BetterLoggerProperties}.
 *
 * <p>
 * One logger instance is shared by every instrumented component so that the database connection
 * pool is created at most once. The pool is released when the context closes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BetterLoggerProperties.class)
public class BetterLoggerConfiguration {

    /**
     * Creates the application-wide logger.
     *
     * @param properties bound {@code betterlogger.*} properties
     * @return logger
     */
    @Bean(destroyMethod = "close")
    public BetterLogger betterLogger(BetterLoggerProperties properties) {
        LoggerConfig config = properties.toLoggerConfig();
        log.info("Creating BetterLogger. logFile={}, includeDatabase={}, databaseType={}",
                config.getLogFilePath(), config.isIncludeDatabase(), config.getDatabaseType());
        return new BetterLogger(config);
    }
}
