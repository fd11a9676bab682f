/**
 * Function-call instrumentation.
 *
 * <p>
 * {@link io.github.yok.betterlogger.instrument.Instrumentation} surrounds a callable with entry,
 * argument, duration, result and failure records. Call names and arguments are passed explicitly
 * through {@link io.github.yok.betterlogger.instrument.CallSite}.
 * </p>
 */
package io.github.yok.betterlogger.instrument;
