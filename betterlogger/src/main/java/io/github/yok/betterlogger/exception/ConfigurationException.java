package io.github.yok.betterlogger.exception;

/**
 * Thrown when the database settings are incomplete or invalid: missing credentials, an unknown
 * database type, or a missing table name.
 *
 * <p>
 * Raised before any network attempt and never retried.
 * </p>
 */
public class ConfigurationException extends BetterLoggerException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
