package io.github.yok.ordersync.config;

/**
 * Enumerates how a validated batch is written into the order store.
 *
 * <ul>
 * <li>SYNC: incremental upsert of the batch, deleting persisted rows that are absent from it</li>
 * <li>OVERWRITE: clear the store and load the batch from a clean slate</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum SyncMode {
    // Upsert staged rows, delete missing items, cascade to orphaned orders
    SYNC,
    // Delete every item and order, then load the batch
    OVERWRITE
}
