/**
 * Configuration model package for OrderSync.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: input/export paths,
 * the default write mode, accepted date patterns and the store connection.
 * </p>
 *
 * <p>
 * This package only holds configuration data; execution logic lives in {@code core} and
 * {@code db}.
 * </p>
 */
package io.github.yok.ordersync.config;
