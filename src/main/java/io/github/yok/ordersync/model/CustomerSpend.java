package io.github.yok.ordersync.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Total spend of one customer.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class CustomerSpend {

    private final String customerId;
    private final BigDecimal total;
}
