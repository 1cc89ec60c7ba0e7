package io.github.yok.ordersync.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.yok.ordersync.model.OrderItem;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * JSON shape of one order item.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
@JsonPropertyOrder({"item", "quantity", "unit_price", "is_valid", "error_message"})
public class ExportedItem {

    @JsonProperty("item")
    private final String item;

    @JsonProperty("quantity")
    private final Integer quantity;

    @JsonProperty("unit_price")
    private final BigDecimal unitPrice;

    @JsonProperty("is_valid")
    private final boolean valid;

    @JsonProperty("error_message")
    private final String errorMessage;

    static ExportedItem of(OrderItem item) {
        return new ExportedItem(item.getItem(), item.getQuantity(), item.getUnitPrice(),
                item.isValid(), item.getErrorMessage());
    }
}
