package io.github.yok.ordersync.model;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An active order with all of its current items, valid or invalid.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class OrderWithItems {

    private final Order order;
    private final List<OrderItem> items;

    /**
     * Creates an order snapshot.
     *
     * @param order order
     * @param items items of the order, in store order
     */
    public OrderWithItems(Order order, List<OrderItem> items) {
        this.order = order;
        this.items = ImmutableList.copyOf(items);
    }

    /**
     * Sums the line totals of billable items.
     *
     * @return unrounded total, {@link BigDecimal#ZERO} when no item is billable
     */
    public BigDecimal billableTotal() {
        return items.stream().filter(OrderItem::isBillable).map(OrderItem::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
