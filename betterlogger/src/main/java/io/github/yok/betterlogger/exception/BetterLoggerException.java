package io.github.yok.betterlogger.exception;

/**
 * Base exception for all BetterLogger errors.
 *
 * <p>
 * Failures raised by an instrumented function are never wrapped in this type; they reach the caller
 * unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class BetterLoggerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BetterLoggerException(String message) {
        super(message);
    }

    public BetterLoggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
