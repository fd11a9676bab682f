/**
 * Exception hierarchy for configuration, connection, schema and insert failures.
 */
package io.github.yok.betterlogger.exception;
