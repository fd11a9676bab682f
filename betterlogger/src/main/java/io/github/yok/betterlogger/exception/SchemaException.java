package io.github.yok.betterlogger.exception;

/**
 * Thrown when the log table DDL fails.
 */
public class SchemaException extends BetterLoggerException {

    private static final long serialVersionUID = 1L;

    private final String tableName;

    public SchemaException(String tableName, Throwable cause) {
        super("Failed to ensure log table: " + tableName, cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
