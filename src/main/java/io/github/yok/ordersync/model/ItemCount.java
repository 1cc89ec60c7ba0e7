package io.github.yok.ordersync.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Number of distinct items of one order.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class ItemCount {

    private final String orderId;
    private final int distinctItems;
}
