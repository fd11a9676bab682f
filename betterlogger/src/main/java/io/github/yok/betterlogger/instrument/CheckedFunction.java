package io.github.yok.betterlogger.instrument;

/**
 * One-argument callable that may throw {@code E}.
 *
 * @param <A> argument type
 * @param <R> result type
 * @param <E> exception type
 */
@FunctionalInterface
public interface CheckedFunction<A, R, E extends Exception> {

    R apply(A argument) throws E;
}
