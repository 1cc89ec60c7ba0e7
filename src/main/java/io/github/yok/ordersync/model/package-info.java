/**
 * Domain model package.
 *
 * <p>
 * Holds the validated row record, the persisted order/order-item shapes and the immutable result
 * types returned by synchronization and aggregation.
 * </p>
 */
package io.github.yok.ordersync.model;
