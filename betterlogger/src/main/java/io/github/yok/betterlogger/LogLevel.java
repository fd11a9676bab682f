package io.github.yok.betterlogger;

import lombok.Generated;

/**
 * Common level labels. Levels are free-form strings; these are the ones the library emits itself.
 *
 * @author Yasuharu.Okawauchi
 */
public final class LogLevel {

    public static final String DEBUG = "DEBUG";
    public static final String INFO = "INFO";
    public static final String WARNING = "WARNING";
    public static final String ERROR = "ERROR";
    public static final String CRITICAL = "CRITICAL";

    @Generated
    private LogLevel() {}
}
