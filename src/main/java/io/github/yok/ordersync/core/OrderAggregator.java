package io.github.yok.ordersync.core;

import io.github.yok.ordersync.db.OrderStore;
import io.github.yok.ordersync.model.AggregationReport;
import io.github.yok.ordersync.model.CustomerSpend;
import io.github.yok.ordersync.model.ItemCount;
import io.github.yok.ordersync.model.OrderTotal;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the read-only aggregation queries over the current store contents.
 *
 * <ul>
 * <li>Order totals: {@code quantity × unit_price} per order over priced, non-placeholder
 * items.</li>
 * <li>Top customer: highest spend over all priced items, placeholder items included; ties go to
 * the lowest customer id.</li>
 * <li>Distinct item counts per order over items that have a quantity; the placeholder counts as
 * one item.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class OrderAggregator {

    /**
     * Computes all aggregations.
     *
     * @param store order store
     * @return aggregation report
     * @throws SQLException on DB error
     */
    public AggregationReport aggregate(OrderStore store) throws SQLException {
        List<OrderTotal> totals = store.totalsByOrder();
        CustomerSpend top = store.topCustomer().orElse(null);
        List<ItemCount> counts = store.distinctItemCountsByOrder();
        log.debug("Aggregated: orders with totals={}, top customer={}, item counts={}",
                totals.size(), top, counts.size());
        return new AggregationReport(totals, top, counts);
    }
}
