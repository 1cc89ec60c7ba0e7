/**
 * JSON export package.
 *
 * <p>
 * Projects the persisted orders into the JSON snapshot written at the end of a run.
 * </p>
 */
package io.github.yok.ordersync.export;
