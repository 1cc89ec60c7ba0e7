package io.github.yok.ordersync.core;

import com.google.common.base.Preconditions;
import io.github.yok.ordersync.config.SyncMode;
import io.github.yok.ordersync.db.OrderStore;
import io.github.yok.ordersync.model.Order;
import io.github.yok.ordersync.model.OrderItem;
import io.github.yok.ordersync.model.OrderKey;
import io.github.yok.ordersync.model.SyncResult;
import io.github.yok.ordersync.model.ValidatedRecord;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconciles a validated batch against the persisted order store.
 *
 * <p>
 * <strong>Operating modes:</strong>
 * </p>
 * <ul>
 * <li><strong>overwrite</strong>: delete all items and orders, then upsert every record.</li>
 * <li><strong>sync</strong> (default)
 * <ol>
 * <li>Stage the batch by {@code (order_id, item)}, last write wins.</li>
 * <li>Upsert the order and the item of every staged record.</li>
 * <li>Delete items whose key is not staged.</li>
 * <li>Delete orders left without items.</li>
 * <li>Clear the staging area.</li>
 * </ol>
 * </li>
 * </ul>
 *
 * <p>
 * Either mode runs in a single transaction: it is committed as a whole or rolled back as a whole,
 * so the store is never observed half-synced. Afterwards the persisted item keys equal the staged
 * keys and the persisted orders equal the order ids those items reference.
 * </p>
 *
 * <p>
 * A record without an order id breaks the contract and fails the whole sync.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class OrderReconciler {

    // Factory function to bind an OrderStore to the transaction's connection
    private final Function<Connection, ? extends OrderStore> storeFactory;

    /**
     * Creates a reconciler.
     *
     * @param storeFactory creates the store view over a JDBC connection
     */
    public OrderReconciler(Function<Connection, ? extends OrderStore> storeFactory) {
        this.storeFactory = storeFactory;
    }

    /**
     * Applies the batch to the store in one transaction.
     *
     * @param jdbc JDBC connection; its auto-commit setting is restored afterwards
     * @param batch validated batch, in file order
     * @param mode write mode
     * @return counters of the committed sync
     * @throws SQLException if any statement fails; the transaction is rolled back first
     * @throws IllegalArgumentException if a record has no order id; the transaction is rolled back
     *         first
     */
    public SyncResult reconcile(Connection jdbc, List<ValidatedRecord> batch, SyncMode mode)
            throws SQLException {
        Preconditions.checkNotNull(batch, "batch must not be null");
        Preconditions.checkNotNull(mode, "mode must not be null");
        log.info("=== Reconciliation started (mode={}, records={}) ===", mode, batch.size());

        boolean autoCommit = jdbc.getAutoCommit();
        jdbc.setAutoCommit(false);
        try {
            OrderStore store = storeFactory.apply(jdbc);
            SyncResult result = mode == SyncMode.OVERWRITE ? overwrite(store, batch)
                    : incrementalSync(store, batch);
            jdbc.commit();
            log.info("Transaction committed: {}", result);
            return result;
        } catch (Exception e) {
            try {
                jdbc.rollback();
                log.warn("Transaction rolled back due to error: {}", e.getMessage());
            } catch (SQLException rollbackEx) {
                log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
                e.addSuppressed(rollbackEx);
            }
            throw e;
        } finally {
            jdbc.setAutoCommit(autoCommit);
        }
    }

    /**
     * Clears the store and loads the batch. Repeated keys in the batch resolve to the last record.
     *
     * @param store order store
     * @param batch validated batch
     * @return counters
     * @throws SQLException on DB error
     */
    SyncResult overwrite(OrderStore store, List<ValidatedRecord> batch) throws SQLException {
        log.info("Overwrite mode: clearing existing data");
        int deletedItems = store.childKeys().size();
        int deletedOrders = store.parentIds().size();
        store.deleteAll();

        Set<OrderKey> keys = new HashSet<>();
        Set<String> orderIds = new HashSet<>();
        for (ValidatedRecord record : batch) {
            requireKey(record);
            OrderItem item = OrderItem.of(record);
            store.upsertParent(Order.of(record));
            store.upsertChild(item);
            keys.add(item.key());
            orderIds.add(record.getOrderId());
        }
        return new SyncResult(SyncMode.OVERWRITE, keys.size(), orderIds.size(), deletedItems,
                deletedOrders);
    }

    /**
     * Incremental sync of the batch against the store (steps 1-5 of the class description).
     *
     * @param store order store
     * @param batch validated batch
     * @return counters
     * @throws SQLException on DB error
     */
    SyncResult incrementalSync(OrderStore store, List<ValidatedRecord> batch)
            throws SQLException {
        log.info("Sync mode: incremental upsert with deletes of missing rows");
        StagingArea staging = new StagingArea();
        try {
            for (ValidatedRecord record : batch) {
                requireKey(record);
                if (!staging.stage(record)) {
                    log.debug("Staging replaced earlier record for order_id={}, item={}",
                            record.getOrderId(), record.getItem());
                }
            }
            log.info("Staged {} item(s) from {} record(s)", staging.size(), batch.size());

            Set<String> orderIds = new HashSet<>();
            for (ValidatedRecord record : staging.records()) {
                store.upsertParent(Order.of(record));
                store.upsertChild(OrderItem.of(record));
                orderIds.add(record.getOrderId());
            }

            int deletedItems = store.deleteChildrenNotIn(staging.keys());
            int deletedOrders = store.deleteOrphanParents();
            log.info("Upserted items={}, orders={}; deleted items={}, orders={}", staging.size(),
                    orderIds.size(), deletedItems, deletedOrders);

            return new SyncResult(SyncMode.SYNC, staging.size(), orderIds.size(), deletedItems,
                    deletedOrders);
        } finally {
            staging.clear();
        }
    }

    private static void requireKey(ValidatedRecord record) {
        Preconditions.checkNotNull(record, "batch must not contain null records");
        Preconditions.checkArgument(record.hasOrderId(), "Record without order_id: %s", record);
    }
}
