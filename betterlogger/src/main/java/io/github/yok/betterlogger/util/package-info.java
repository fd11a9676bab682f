/**
 * Small helpers shared by the sinks and the connection manager.
 */
package io.github.yok.betterlogger.util;
