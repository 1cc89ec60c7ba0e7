package io.github.yok.ordersync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.ordersync.db.OrderStore;
import io.github.yok.ordersync.model.AggregationReport;
import io.github.yok.ordersync.model.CustomerSpend;
import io.github.yok.ordersync.model.ItemCount;
import io.github.yok.ordersync.model.OrderTotal;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OrderAggregatorTest {

    private final OrderAggregator aggregator = new OrderAggregator();

    @Test
    void aggregate_正常ケース_ストアに集計結果がある_レポートにまとめられること() throws Exception {
        OrderStore store = mock(OrderStore.class);
        List<OrderTotal> totals = List.of(new OrderTotal("1", "C1", new BigDecimal("19.98")));
        CustomerSpend top = new CustomerSpend("C1", new BigDecimal("19.98"));
        List<ItemCount> counts = List.of(new ItemCount("1", 1));
        when(store.totalsByOrder()).thenReturn(totals);
        when(store.topCustomer()).thenReturn(Optional.of(top));
        when(store.distinctItemCountsByOrder()).thenReturn(counts);

        AggregationReport report = aggregator.aggregate(store);

        assertEquals(totals, report.getOrderTotals());
        assertEquals(top, report.findTopCustomer().get());
        assertEquals(counts, report.getItemCounts());
        verify(store, never()).deleteAll();
    }

    @Test
    void aggregate_正常ケース_対象顧客がいない_トップ顧客が空となること() throws Exception {
        OrderStore store = mock(OrderStore.class);
        when(store.totalsByOrder()).thenReturn(List.of());
        when(store.topCustomer()).thenReturn(Optional.empty());
        when(store.distinctItemCountsByOrder()).thenReturn(List.of());

        AggregationReport report = aggregator.aggregate(store);

        assertFalse(report.findTopCustomer().isPresent());
        assertNull(report.getTopCustomer());
    }

    @Test
    void aggregate_異常ケース_クエリが失敗する_SQLExceptionが送出されること() throws Exception {
        OrderStore store = mock(OrderStore.class);
        when(store.totalsByOrder()).thenThrow(new SQLException("closed"));

        assertThrows(SQLException.class, () -> aggregator.aggregate(store));
    }
}
