package io.github.yok.betterlogger.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for masking credentials before connection information is written to diagnostic logs.
 *
 * <p>
 * Connection URLs built by the dialects embed the user name and password as URL properties. This
 * helper replaces the password value while keeping the host, database and user visible for
 * troubleshooting. Both the MySQL form ({@code &password=secret}) and the SQL Server form
 * ({@code ;password={secret}}) are recognized.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Pattern that matches a password property, brace-quoted or plain.
     */
    private static final Pattern PASSWORD_PROPERTY_PATTERN =
            Pattern.compile("(?i)(password=)(\\{(?:[^}]|\\}\\})*\\}|[^;&]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks password properties in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = PASSWORD_PROPERTY_PATTERN.matcher(url);
        return matcher.replaceAll("$1***");
    }
}
