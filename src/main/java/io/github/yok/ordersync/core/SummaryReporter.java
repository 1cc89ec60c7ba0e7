package io.github.yok.ordersync.core;

import io.github.yok.ordersync.model.AggregationReport;
import io.github.yok.ordersync.model.ItemCount;
import io.github.yok.ordersync.model.OrderItem;
import io.github.yok.ordersync.model.OrderTotal;
import io.github.yok.ordersync.model.SyncResult;
import io.github.yok.ordersync.model.ValidatedRecord;
import io.github.yok.ordersync.model.ValidationSummary;
import io.github.yok.ordersync.util.Decimals;
import java.math.BigDecimal;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the human-readable run report to the log.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
class SummaryReporter {

    void reportValidation(ValidationSummary summary) {
        log.info("===== Validation =====");
        log.info("Rows processed: {}", summary.getProcessed());
        log.info("  Valid={}, Invalid={} (duplicates={}), Without order_id={}",
                summary.getValid(), summary.getInvalid(), summary.getDuplicates(),
                summary.getUnkeyed());
    }

    void reportUnkeyedRows(List<ValidatedRecord> unkeyedRows) {
        if (unkeyedRows.isEmpty()) {
            return;
        }
        log.warn("Rows without order_id (not stored): {}", unkeyedRows.size());
        for (ValidatedRecord row : unkeyedRows) {
            log.warn("- Customer ID: {}, Item: {}, Quantity: {}, Unit Price: {}, Date: {},"
                    + " Error: {}", row.getCustomerId(), row.getItem(), row.getQuantity(),
                    row.getUnitPrice(), row.getDate(), row.getErrorMessage());
        }
    }

    void reportSync(SyncResult result) {
        log.info("===== Sync ({}) =====", result.getMode());
        log.info("  Items written={}, Orders written={}, Items deleted={}, Orders deleted={}",
                result.getStagedItems(), result.getUpsertedOrders(), result.getDeletedItems(),
                result.getDeletedOrders());
    }

    void reportInvalidItems(List<OrderItem> invalidItems) {
        log.info("Invalid rows needing review: {}", invalidItems.size());
        for (OrderItem item : invalidItems) {
            log.info("- Order ID: {}, Item: {}, Quantity: {}, Unit Price: {}, Error: {}",
                    item.getOrderId(), item.getItem(), item.getQuantity(), item.getUnitPrice(),
                    item.getErrorMessage());
        }
    }

    void reportAggregations(AggregationReport report) {
        log.info("===== Order Analytics =====");
        log.info("Total Value Per Order:");
        for (OrderTotal total : report.getOrderTotals()) {
            log.info("- Order ID: {}, Customer ID: {}, Total Value: ${}", total.getOrderId(),
                    total.getCustomerId(), money(total.getTotal()));
        }
        report.findTopCustomer()
                .ifPresent(top -> log.info("Top Customer: {} with Total Spend: ${}",
                        top.getCustomerId(), money(top.getTotal())));
        log.info("Unique Items Per Order:");
        for (ItemCount count : report.getItemCounts()) {
            log.info("- Order ID: {}, Unique Items: {}", count.getOrderId(),
                    count.getDistinctItems());
        }
    }

    private static String money(BigDecimal value) {
        return Decimals.toMoney(value).toPlainString();
    }
}
