/**
 * Order store package.
 *
 * <p>
 * Provides the store abstraction, its JDBC implementation over embedded H2, schema creation and
 * connection handling.
 * </p>
 */
package io.github.yok.ordersync.db;
