package io.github.yok.betterlogger.db.mysql;

import io.github.yok.betterlogger.config.DatabaseCredentials;
import io.github.yok.betterlogger.db.DatabaseDialect;
import io.github.yok.betterlogger.db.DatabaseType;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * MySQL dialect.
 *
 * <p>
 * The URL has the form
 * {@code jdbc:mysql://<server>/<database>?user=<user>&password=<password>}. Every embedded value is
 * percent-encoded; Connector/J decodes them again, so passwords containing {@code @}, {@code &},
 * {@code /} or spaces are accepted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialect implements DatabaseDialect {

    @Override
    public DatabaseType getType() {
        return DatabaseType.MYSQL;
    }

    @Override
    public String buildJdbcUrl(DatabaseCredentials credentials, Map<String, String> properties) {
        StringBuilder url = new StringBuilder("jdbc:mysql://");
        url.append(credentials.getServer().trim());
        url.append('/').append(encode(credentials.getName()));
        url.append("?user=").append(encode(credentials.getUsername()));
        url.append("&password=").append(encode(credentials.getPassword()));
        properties.forEach((key, value) -> url.append('&').append(encode(key)).append('=')
                .append(encode(value)));
        return url.toString();
    }

    /**
     * Quotes an identifier with backticks; embedded backticks are doubled. A database-qualified
     * name such as {@code logs.AppLogs} is quoted part by part.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return Arrays.stream(identifier.split("\\.", -1))
                .map(part -> "`" + part.replace("`", "``") + "`")
                .collect(Collectors.joining("."));
    }

    @Override
    public String createTableIfNotExistsSql(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + quoteIdentifier(tableName) + " ("
                + "LogID INT AUTO_INCREMENT PRIMARY KEY, "
                + "LogTime DATETIME(3) DEFAULT CURRENT_TIMESTAMP(3), "
                + "LogLevel VARCHAR(50), "
                + "LogMessage LONGTEXT)";
    }

    // Percent-encoding with %20 for spaces; Connector/J does not treat '+' as a space
    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
