/**
 * Root package of the order sync CLI.
 *
 * <p>
 * Reads ERP order CSV exports, reconciles them into an embedded H2 store, logs order analytics
 * and writes a JSON snapshot of the active orders.
 * </p>
 */
package io.github.yok.ordersync;
