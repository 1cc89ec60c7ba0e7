package io.github.yok.ordersync.model;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Natural key of an order item: {@code (order_id, item)}.
 *
 * <p>
 * A missing item name is replaced by {@link #PLACEHOLDER_ITEM} so that the key never contains
 * {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class OrderKey {

    /**
     * Sentinel stored in place of an empty item name.
     */
    public static final String PLACEHOLDER_ITEM = "__BLANK_ITEM__";

    private final String orderId;
    private final String item;

    /**
     * Creates a key from an order id and an item name.
     *
     * @param orderId order id (required)
     * @param item item name; {@code null} or blank is replaced by {@link #PLACEHOLDER_ITEM}
     * @throws IllegalArgumentException if {@code orderId} is {@code null}
     */
    public OrderKey(String orderId, String item) {
        Preconditions.checkArgument(orderId != null, "order_id must not be null");
        this.orderId = orderId;
        this.item = StringUtils.isEmpty(item) ? PLACEHOLDER_ITEM : item;
    }

    /**
     * Builds the key of a validated record.
     *
     * @param record validated record
     * @return natural key
     * @throws IllegalArgumentException if the record has no order id
     */
    public static OrderKey of(ValidatedRecord record) {
        return new OrderKey(record.getOrderId(), record.getItem());
    }

    /**
     * Returns whether the item part is the placeholder.
     *
     * @return {@code true} for a placeholder item
     */
    public boolean isPlaceholder() {
        return PLACEHOLDER_ITEM.equals(item);
    }

    @Override
    public String toString() {
        return "(" + orderId + ", " + item + ")";
    }
}
