package io.github.yok.ordersync.model;

import io.github.yok.ordersync.config.SyncMode;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Counters describing one committed synchronization.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class SyncResult {

    private final SyncMode mode;
    // Distinct (order_id, item) keys written
    private final int stagedItems;
    // Distinct order ids written
    private final int upsertedOrders;
    private final int deletedItems;
    private final int deletedOrders;
}
