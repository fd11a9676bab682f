package io.github.yok.betterlogger.instrument;

/**
 * Two-argument callable that may throw {@code E}.
 *
 * @param <A> first argument type
 * @param <B> second argument type
 * @param <R> result type
 * @param <E> exception type
 */
@FunctionalInterface
public interface CheckedBiFunction<A, B, R, E extends Exception> {

    R apply(A first, B second) throws E;
}
