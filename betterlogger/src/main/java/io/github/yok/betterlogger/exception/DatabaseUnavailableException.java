package io.github.yok.betterlogger.exception;

/**
 * Thrown when the database cannot be reached: network, authentication or pool start-up failure.
 */
public class DatabaseUnavailableException extends BetterLoggerException {

    private static final long serialVersionUID = 1L;

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
