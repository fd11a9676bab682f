/**
 * File and database destinations for log records.
 */
package io.github.yok.betterlogger.sink;
