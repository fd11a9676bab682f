package io.github.yok.betterlogger.config;

import lombok.Value;

/**
 * Target log table for the database sink.
 *
 * <p>
 * Not validated here. A missing table name is reported when the first database write is attempted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value(staticConstructor = "of")
public class TableDescriptor {

    // Table name; identifiers are developer-configured and quoted per dialect
    String tableName;

    // Whether the table is created on first write when it does not exist
    boolean createTableIfNotExists;

    /**
     * Returns a descriptor without a table name.
     *
     * @return empty descriptor
     */
    public static TableDescriptor none() {
        return of(null, false);
    }
}
