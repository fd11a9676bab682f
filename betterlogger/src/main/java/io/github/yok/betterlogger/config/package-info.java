/**
 * Configuration models.
 *
 * <p>
 * {@link io.github.yok.betterlogger.config.LoggerConfig} is the immutable settings object used by
 * the library. {@link io.github.yok.betterlogger.config.BetterLoggerProperties} binds the same
 * settings from Spring Boot configuration.
 * </p>
 */
package io.github.yok.betterlogger.config;
