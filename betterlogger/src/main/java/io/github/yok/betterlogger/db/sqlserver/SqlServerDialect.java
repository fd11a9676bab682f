package io.github.yok.betterlogger.db.sqlserver;

import io.github.yok.betterlogger.config.DatabaseCredentials;
import io.github.yok.betterlogger.db.DatabaseDialect;
import io.github.yok.betterlogger.db.DatabaseType;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SQL Server dialect.
 *
 * <p>
 * The URL has the form
 * {@code jdbc:sqlserver://<server>;databaseName={<db>};user={<user>};password={<password>}}. The
 * Microsoft driver does not decode percent escapes, so values are wrapped in braces instead, with
 * any closing brace doubled. This keeps {@code ;}, {@code =} and {@code @} in passwords intact.
 * Extra driver properties are appended as given.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlServerDialect implements DatabaseDialect {

    @Override
    public DatabaseType getType() {
        return DatabaseType.MSSQL;
    }

    @Override
    public String buildJdbcUrl(DatabaseCredentials credentials, Map<String, String> properties) {
        StringBuilder url = new StringBuilder("jdbc:sqlserver://");
        url.append(credentials.getServer().trim());
        url.append(";databaseName=").append(brace(credentials.getName()));
        url.append(";user=").append(brace(credentials.getUsername()));
        url.append(";password=").append(brace(credentials.getPassword()));
        properties.forEach(
                (key, value) -> url.append(';').append(key).append('=').append(value));
        return url.toString();
    }

    /**
     * Quotes an identifier with square brackets; embedded closing brackets are doubled. A
     * schema-qualified name such as {@code dbo.AppLogs} is quoted part by part.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return Arrays.stream(identifier.split("\\.", -1))
                .map(part -> "[" + part.replace("]", "]]") + "]")
                .collect(Collectors.joining("."));
    }

    @Override
    public String createTableIfNotExistsSql(String tableName) {
        String objectName = quoteIdentifier(tableName).replace("'", "''");
        return "IF OBJECT_ID(N'" + objectName + "', N'U') IS NULL "
                + "CREATE TABLE " + quoteIdentifier(tableName) + " ("
                + "LogID INT IDENTITY(1,1) PRIMARY KEY, "
                + "LogTime DATETIME2(3) DEFAULT SYSDATETIME(), "
                + "LogLevel NVARCHAR(50), "
                + "LogMessage NVARCHAR(MAX))";
    }

    private static String brace(String value) {
        return "{" + value.replace("}", "}}") + "}";
    }
}
