package io.github.yok.ordersync.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class OrderItemTest {

    @Test
    void of_正常ケース_アイテム名なしのレコードを指定する_プレースホルダの項目となること() {
        ValidatedRecord record = new ValidatedRecord("C1", "1", null, 1, BigDecimal.TEN,
                LocalDate.of(2025, 6, 1), false, "Invalid or missing item");

        OrderItem item = OrderItem.of(record);

        assertEquals(OrderKey.PLACEHOLDER_ITEM, item.getItem());
        assertTrue(item.isPriced());
        assertFalse(item.isBillable());
        assertEquals("Invalid or missing item", item.getErrorMessage());
    }

    @Test
    void isBillable_異常ケース_空のアイテム名で生成する_プレースホルダとして課金対象外となること() {
        OrderItem item = new OrderItem("1", "", 1, BigDecimal.TEN, true, null);

        assertTrue(item.key().isPlaceholder());
        assertTrue(item.isPriced());
        assertFalse(item.isBillable());
    }

    @Test
    void lineTotal_正常ケース_数量と単価がある_積が返ること() {
        OrderItem item = new OrderItem("1", "Widget", 3, new BigDecimal("0.10"), true, null);

        assertEquals(new BigDecimal("0.30"), item.lineTotal());
        assertTrue(item.isBillable());
    }

    @Test
    void lineTotal_正常ケース_数量がない_nullが返ること() {
        OrderItem item = new OrderItem("1", "Widget", null, BigDecimal.ONE, false, "x");

        assertNull(item.lineTotal());
        assertFalse(item.isPriced());
    }

    @Test
    void billableTotal_正常ケース_混在した項目を指定する_課金対象のみ合計されること() {
        OrderWithItems order = new OrderWithItems(new Order("1", "C1", null), List.of(
                new OrderItem("1", "Widget", 2, new BigDecimal("9.99"), true, null),
                new OrderItem("1", OrderKey.PLACEHOLDER_ITEM, 1, BigDecimal.TEN, false, "x"),
                new OrderItem("1", "Gizmo", 1, null, false, "y")));

        assertEquals(new BigDecimal("19.98"), order.billableTotal());
    }
}
