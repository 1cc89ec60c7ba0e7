package io.github.yok.ordersync.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of the three aggregation queries over the current store contents.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AggregationReport {

    private final List<OrderTotal> orderTotals;
    private final CustomerSpend topCustomer;
    private final List<ItemCount> itemCounts;

    /**
     * Creates a report.
     *
     * @param orderTotals totals per order
     * @param topCustomer highest-spending customer, or {@code null} if none qualifies
     * @param itemCounts distinct item counts per order
     */
    public AggregationReport(List<OrderTotal> orderTotals, CustomerSpend topCustomer,
            List<ItemCount> itemCounts) {
        this.orderTotals = ImmutableList.copyOf(orderTotals);
        this.topCustomer = topCustomer;
        this.itemCounts = ImmutableList.copyOf(itemCounts);
    }

    /**
     * Returns the top customer, if any.
     *
     * @return top customer
     */
    public Optional<CustomerSpend> findTopCustomer() {
        return Optional.ofNullable(topCustomer);
    }
}
