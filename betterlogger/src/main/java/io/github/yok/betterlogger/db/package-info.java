/**
 * Database connection, dialect and schema handling for the database sink.
 *
 * <p>
 * Database-specific URL and DDL grammar lives in the subpackages {@code mysql} and
 * {@code sqlserver}. {@link io.github.yok.betterlogger.db.ConnectionManager} owns the single
 * connection pool of a logger instance.
 * </p>
 */
package io.github.yok.betterlogger.db;
