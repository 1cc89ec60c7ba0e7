/**
 * Utility package for OrderSync.
 *
 * <p>
 * Provides small stateless helpers used across the project: fatal error reporting, monetary
 * rounding and log path rendering.
 * </p>
 */
package io.github.yok.ordersync.util;
