package io.github.yok.ordersync.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Normalized, typed representation of one CSV row together with its validation verdict.
 *
 * <p>
 * Instances are created once per input row by the validator and never change afterwards; the
 * duplicate check produces a new instance through {@link #markDuplicate()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class ValidatedRecord {

    /**
     * Error message assigned to the second and later occurrences of an (order_id, item) key.
     */
    public static final String DUPLICATE_MESSAGE = "Duplicate order_id and item";

    private final String customerId;
    private final String orderId;
    private final String item;
    private final Integer quantity;
    private final BigDecimal unitPrice;
    private final LocalDate date;
    private final boolean valid;
    private final String errorMessage;

    /**
     * Returns a copy of this record flagged as a duplicate.
     *
     * @return invalid copy carrying {@link #DUPLICATE_MESSAGE}
     */
    public ValidatedRecord markDuplicate() {
        return new ValidatedRecord(customerId, orderId, item, quantity, unitPrice, date, false,
                DUPLICATE_MESSAGE);
    }

    /**
     * Returns whether the record carries an order id and can therefore be persisted.
     *
     * @return {@code true} if {@code orderId} is present
     */
    public boolean hasOrderId() {
        return orderId != null;
    }
}
