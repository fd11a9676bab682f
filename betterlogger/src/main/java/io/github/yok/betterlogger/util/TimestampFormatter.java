package io.github.yok.betterlogger.util;

import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Produces the millisecond-precision timestamps written in front of every log line.
 *
 * <p>
 * The format is {@value #PATTERN} with English month names regardless of the default locale, for
 * example {@code 05 March 2025 14:03:22.123}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TimestampFormatter {

    /**
     * Pattern used for every log line.
     */
    public static final String PATTERN = "dd MMMM yyyy HH:mm:ss.SSS";

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern(PATTERN, Locale.ENGLISH);

    private final Clock clock;

    /**
     * Creates a formatter backed by the system clock in the default time zone.
     */
    public TimestampFormatter() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Creates a formatter backed by the given clock.
     *
     * @param clock clock used by {@link #now()}
     */
    public TimestampFormatter(Clock clock) {
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
    }

    /**
     * Returns the current instant truncated to milliseconds.
     *
     * @return current local date-time
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Formats a local date-time.
     *
     * @param time value to format
     * @return formatted timestamp
     */
    public String format(LocalDateTime time) {
        Preconditions.checkNotNull(time, "time must not be null");
        return FORMATTER.format(time);
    }

    /**
     * Parses a timestamp previously produced by {@link #format(LocalDateTime)}.
     *
     * @param text formatted timestamp
     * @return parsed local date-time
     * @throws java.time.format.DateTimeParseException if the text does not match {@value #PATTERN}
     */
    public static LocalDateTime parse(String text) {
        return LocalDateTime.parse(text, FORMATTER);
    }
}
