/**
 * Core processing package.
 *
 * <p>
 * Contains the reconciliation of a validated batch against the store, the aggregations and the
 * end-to-end pipeline that ties reading, syncing, reporting and exporting together.
 * </p>
 */
package io.github.yok.ordersync.core;
