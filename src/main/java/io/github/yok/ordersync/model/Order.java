package io.github.yok.ordersync.model;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Persisted order (parent record), keyed by {@code orderId}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class Order {

    private final String orderId;
    private final String customerId;
    private final LocalDate orderDate;

    /**
     * Derives the order part of a validated record.
     *
     * @param record validated record
     * @return order carrying the record's customer and date
     */
    public static Order of(ValidatedRecord record) {
        return new Order(record.getOrderId(), record.getCustomerId(), record.getDate());
    }
}
