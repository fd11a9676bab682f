/**
 * Root package of BetterLogger.
 *
 * <p>
 * Provides a call-instrumentation logger that records invocations, arguments, results, durations
 * and failures to a log file and, optionally, a SQL Server or MySQL table.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.betterlogger.config}: configuration models</li>
 * <li>{@code io.github.yok.betterlogger.instrument}: function-call instrumentation</li>
 * <li>{@code io.github.yok.betterlogger.sink}: file and database sinks</li>
 * <li>{@code io.github.yok.betterlogger.db}: connection pool, dialects and schema handling</li>
 * </ul>
 */
package io.github.yok.betterlogger;
