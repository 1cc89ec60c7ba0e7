package io.github.yok.ordersync.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Total value of one order: {@code (order_id, customer_id, total)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class OrderTotal {

    private final String orderId;
    private final String customerId;
    private final BigDecimal total;
}
