package io.github.yok.betterlogger.db;

import io.github.yok.betterlogger.exception.ConfigurationException;
import java.util.Locale;

/**
 * Supported database families.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DatabaseType {

    /**
     * Microsoft SQL Server.
     */
    MSSQL("mssql"),

    /**
     * MySQL and compatible servers.
     */
    MYSQL("mysql");

    private final String tag;

    DatabaseType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the configuration tag of this type.
     *
     * @return tag such as {@code mssql}
     */
    public String getTag() {
        return tag;
    }

    /**
     * Resolves a type from its configuration tag, ignoring case and surrounding blanks.
     *
     * @param value configured tag
     * @return resolved type
     * @throws ConfigurationException if the tag is not supported
     */
    public static DatabaseType fromTag(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DatabaseType type : values()) {
                if (type.tag.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException("Invalid database type: '" + value
                + "'. Supported values are 'mssql' and 'mysql'.");
    }
}
