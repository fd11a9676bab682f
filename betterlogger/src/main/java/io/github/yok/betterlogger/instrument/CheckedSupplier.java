package io.github.yok.betterlogger.instrument;

/**
 * Zero-argument callable that may throw {@code E}.
 *
 * @param <T> result type
 * @param <E> exception type
 */
@FunctionalInterface
public interface CheckedSupplier<T, E extends Exception> {

    T get() throws E;
}
