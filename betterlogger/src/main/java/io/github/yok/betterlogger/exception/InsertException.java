package io.github.yok.betterlogger.exception;

/**
 * Thrown when a log row cannot be inserted.
 */
public class InsertException extends BetterLoggerException {

    private static final long serialVersionUID = 1L;

    private final String tableName;

    public InsertException(String tableName, Throwable cause) {
        super("Failed to insert log record into table: " + tableName, cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
