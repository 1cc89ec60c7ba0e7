package io.github.yok.ordersync.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.yok.ordersync.model.Order;
import io.github.yok.ordersync.model.OrderWithItems;
import io.github.yok.ordersync.util.Decimals;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * JSON shape of one active order.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
@JsonPropertyOrder({"order_id", "customer_id", "date", "total_price", "items"})
public class ExportedOrder {

    @JsonProperty("order_id")
    private final String orderId;

    @JsonProperty("customer_id")
    private final String customerId;

    // ISO yyyy-MM-dd
    @JsonProperty("date")
    private final String date;

    @JsonProperty("total_price")
    private final BigDecimal totalPrice;

    @JsonProperty("items")
    private final List<ExportedItem> items;

    /**
     * Projects an order snapshot. {@code total_price} sums billable items only and is rounded to
     * two places; {@code items} lists every item.
     *
     * @param snapshot order with its items
     * @return export element
     */
    static ExportedOrder of(OrderWithItems snapshot) {
        Order order = snapshot.getOrder();
        List<ExportedItem> items =
                snapshot.getItems().stream().map(ExportedItem::of).collect(Collectors.toList());
        return new ExportedOrder(order.getOrderId(), order.getCustomerId(),
                Objects.toString(order.getOrderDate(), null),
                Decimals.toMoney(snapshot.billableTotal()), items);
    }
}
