package io.github.yok.ordersync.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Persisted order item (child record), keyed by {@code (orderId, item)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class OrderItem {

    private final String orderId;
    private final String item;
    private final Integer quantity;
    private final BigDecimal unitPrice;
    private final boolean valid;
    private final String errorMessage;

    /**
     * Derives the item part of a validated record, normalizing a missing item to the placeholder.
     *
     * @param record validated record
     * @return order item
     */
    public static OrderItem of(ValidatedRecord record) {
        OrderKey key = OrderKey.of(record);
        return new OrderItem(key.getOrderId(), key.getItem(), record.getQuantity(),
                record.getUnitPrice(), record.isValid(), record.getErrorMessage());
    }

    /**
     * Returns the natural key of this item.
     *
     * @return key
     */
    public OrderKey key() {
        return new OrderKey(orderId, item);
    }

    /**
     * Returns whether both quantity and unit price are present.
     *
     * @return {@code true} if the item can be priced
     */
    public boolean isPriced() {
        return quantity != null && unitPrice != null;
    }

    /**
     * Returns whether the item counts towards an order total: priced and not a placeholder.
     *
     * @return {@code true} if the item contributes to {@code total_price}
     */
    public boolean isBillable() {
        return isPriced() && !key().isPlaceholder();
    }

    /**
     * Returns {@code quantity × unitPrice}.
     *
     * @return line total, or {@code null} if the item is not priced
     */
    public BigDecimal lineTotal() {
        if (!isPriced()) {
            return null;
        }
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
