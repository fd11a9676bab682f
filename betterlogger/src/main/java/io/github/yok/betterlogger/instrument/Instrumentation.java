package io.github.yok.betterlogger.instrument;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import io.github.yok.betterlogger.BetterLogger;
import io.github.yok.betterlogger.LogLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Wraps callables so that every invocation is logged through a {@link BetterLogger}.
 *
 * <p>
 * For each call the following records are written, in this order:
 * </p>
 * <ol>
 * <li>{@code Calling function: <name>}</li>
 * <li>{@code Positional arguments: [...]} and {@code Keyword arguments: {...}}, when enabled and
 * present</li>
 * <li>the call itself</li>
 * <li>on success: {@code Execution time: <s> seconds} (when enabled) and
 * {@code Return value: <value>}</li>
 * <li>on failure, at ERROR level: {@code Exception occurred in <name>},
 * {@code Exception type: <class>}, {@code Exception message: <message>},
 * {@code Execution time before error: <s> seconds} (when enabled), then {@code Traceback:} and the
 * stack trace (when enabled)</li>
 * </ol>
 * <p>
 * The wrapped callable's result and failure reach the caller unchanged; the same throwable instance
 * is rethrown. If writing a failure record itself fails, that error is attached to the original
 * throwable as suppressed and the remaining failure records are still written to the log file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class Instrumentation {

    private final BetterLogger logger;
    private final LogOptions options;
    private final Ticker ticker;

    /**
     * Creates an instrumentation. Usually obtained from {@link BetterLogger#log(LogOptions)}.
     *
     * @param logger logger receiving the records
     * @param options switches for this instrumentation
     * @param ticker time source for durations
     */
    public Instrumentation(BetterLogger logger, LogOptions options, Ticker ticker) {
        this.logger = Preconditions.checkNotNull(logger, "logger must not be null");
        this.options = Preconditions.checkNotNull(options, "options must not be null");
        this.ticker = Preconditions.checkNotNull(ticker, "ticker must not be null");
    }

    public LogOptions getOptions() {
        return options;
    }

    /**
     * Runs one instrumented call.
     *
     * @param <T> result type
     * @param <E> checked exception type of the target
     * @param callSite name and rendered arguments of the call
     * @param target the call itself
     * @return the target's result
     * @throws E whatever the target throws, unchanged
     */
    public <T, E extends Exception> T invoke(CallSite callSite, CheckedSupplier<T, E> target)
            throws E {
        Preconditions.checkNotNull(callSite, "callSite must not be null");
        Preconditions.checkNotNull(target, "target must not be null");
        String name = callSite.getName();

        write("Calling function: " + name, options.getLogLevel());
        if (options.isIncludeFunctionArgs()) {
            if (!callSite.getPositionalArgs().isEmpty()) {
                write("Positional arguments: " + callSite.getPositionalArgs(),
                        options.getLogLevel());
            }
            if (!callSite.getNamedArgs().isEmpty()) {
                write("Keyword arguments: " + callSite.getNamedArgs(), options.getLogLevel());
            }
        }

        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        T result;
        try {
            result = target.get();
        } catch (Throwable failure) {
            stopwatch.stop();
            reportFailure(name, failure, stopwatch);
            throw failure;
        }
        stopwatch.stop();

        if (options.isIncludeDuration()) {
            write("Execution time: " + seconds(stopwatch) + " seconds", options.getLogLevel());
        }
        write("Return value: " + CallSite.describe(result), options.getLogLevel());
        return result;
    }

    /**
     * Returns an instrumented replacement for a zero-argument callable.
     *
     * @param <T> result type
     * @param <E> checked exception type
     * @param name function name used in the records
     * @param target callable to wrap
     * @return instrumented callable
     */
    public <T, E extends Exception> CheckedSupplier<T, E> wrap(String name,
            CheckedSupplier<T, E> target) {
        Preconditions.checkNotNull(target, "target must not be null");
        CallSite callSite = CallSite.of(name);
        return () -> invoke(callSite, target);
    }

    /**
     * Returns an instrumented replacement for a one-argument callable.
     *
     * @param <A> argument type
     * @param <R> result type
     * @param <E> checked exception type
     * @param name function name used in the records
     * @param target callable to wrap
     * @return instrumented callable
     */
    public <A, R, E extends Exception> CheckedFunction<A, R, E> wrap(String name,
            CheckedFunction<A, R, E> target) {
        Preconditions.checkNotNull(target, "target must not be null");
        return argument -> invoke(CallSite.of(name, argument), () -> target.apply(argument));
    }

    /**
     * Returns an instrumented replacement for a two-argument callable.
     *
     * @param <A> first argument type
     * @param <B> second argument type
     * @param <R> result type
     * @param <E> checked exception type
     * @param name function name used in the records
     * @param target callable to wrap
     * @return instrumented callable
     */
    public <A, B, R, E extends Exception> CheckedBiFunction<A, B, R, E> wrap(String name,
            CheckedBiFunction<A, B, R, E> target) {
        Preconditions.checkNotNull(target, "target must not be null");
        return (first, second) -> invoke(CallSite.of(name, first, second),
                () -> target.apply(first, second));
    }

    private void reportFailure(String name, Throwable failure, Stopwatch stopwatch) {
        List<String> records = new ArrayList<>();
        records.add("Exception occurred in " + name);
        records.add("Exception type: " + failure.getClass().getSimpleName());
        records.add("Exception message: " + StringUtils.defaultString(failure.getMessage()));
        if (options.isIncludeDuration()) {
            records.add("Execution time before error: " + seconds(stopwatch) + " seconds");
        }
        if (options.isIncludeTraceback()) {
            records.add("Traceback:");
            records.add(StringUtils.stripEnd(ExceptionUtils.getStackTrace(failure), null));
        }

        // After the first failed write the rest of the report goes to the file only
        boolean includeDatabase = options.isIncludeDatabase();
        for (String record : records) {
            try {
                logger.logging(record, LogLevel.ERROR, includeDatabase);
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
                includeDatabase = false;
            }
        }
    }

    private void write(String message, String level) {
        logger.logging(message, level, options.isIncludeDatabase());
    }

    private static String seconds(Stopwatch stopwatch) {
        double elapsed = stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1_000_000_000.0;
        return String.format(Locale.ROOT, "%.4f", elapsed);
    }
}
