package io.github.yok.ordersync.core;

import io.github.yok.ordersync.model.OrderKey;
import io.github.yok.ordersync.model.ValidatedRecord;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Transient, keyed materialization of one batch used by incremental sync.
 *
 * <p>
 * Records are keyed by {@code (order_id, item)} with the placeholder applied, so a repeated key
 * keeps its first position and takes the last record (last write wins).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class StagingArea {

    private final Map<OrderKey, ValidatedRecord> staged = new LinkedHashMap<>();

    /**
     * Stages one record.
     *
     * @param record validated record with an order id
     * @return {@code true} if the key was new, {@code false} if an earlier record was replaced
     * @throws IllegalArgumentException if the record has no order id
     */
    boolean stage(ValidatedRecord record) {
        return staged.put(OrderKey.of(record), record) == null;
    }

    /**
     * Returns a read-only view of the staged keys.
     *
     * @return staged keys in first-seen order
     */
    Set<OrderKey> keys() {
        return Collections.unmodifiableSet(staged.keySet());
    }

    /**
     * Returns a read-only view of the staged records.
     *
     * @return staged records in first-seen key order
     */
    Collection<ValidatedRecord> records() {
        return Collections.unmodifiableCollection(staged.values());
    }

    int size() {
        return staged.size();
    }

    void clear() {
        staged.clear();
    }
}
