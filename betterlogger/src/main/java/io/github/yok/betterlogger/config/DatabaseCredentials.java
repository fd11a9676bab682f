package io.github.yok.betterlogger.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Database server, database name and login used by the database sink.
 *
 * <p>
 * All four values are optional at construction time. They are only required once a database write
 * is attempted, see {@link #missingFields()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class DatabaseCredentials {

    // Host name, optionally with port or instance (e.g., "localhost:3306", "db01\\SQLEXPRESS")
    String server;

    // Database (catalog) name
    String name;

    // Login name
    String username;

    // Login password
    @ToString.Exclude
    String password;

    /**
     * Returns the names of the settings that are blank.
     *
     * @return missing setting names in declaration order; empty when all are present
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(server)) {
            missing.add("server");
        }
        if (StringUtils.isBlank(name)) {
            missing.add("name");
        }
        if (StringUtils.isBlank(username)) {
            missing.add("username");
        }
        if (StringUtils.isBlank(password)) {
            missing.add("password");
        }
        return missing;
    }
}
