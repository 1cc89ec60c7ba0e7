package io.github.yok.ordersync.db;

import io.github.yok.ordersync.model.CustomerSpend;
import io.github.yok.ordersync.model.ItemCount;
import io.github.yok.ordersync.model.Order;
import io.github.yok.ordersync.model.OrderItem;
import io.github.yok.ordersync.model.OrderKey;
import io.github.yok.ordersync.model.OrderTotal;
import io.github.yok.ordersync.model.OrderWithItems;
import io.github.yok.ordersync.util.Decimals;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link OrderStore} backed by a JDBC connection to the H2 schema created by
 * {@link SchemaInitializer}.
 *
 * <p>
 * Upserts use H2 {@code MERGE INTO ... KEY (...)}. Deletion of missing items is computed in memory
 * as "persisted keys minus kept keys" and executed as a batch {@code DELETE} by key.
 * </p>
 *
 * <p>
 * The connection is owned by the caller, who also controls commit and rollback.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcOrderStore implements OrderStore {

    static final String UPSERT_ORDER_SQL =
            "MERGE INTO orders (order_id, customer_id, order_date) KEY (order_id) VALUES (?, ?, ?)";

    static final String UPSERT_ITEM_SQL = "MERGE INTO order_items"
            + " (order_id, item, quantity, unit_price, is_valid, error_message)"
            + " KEY (order_id, item) VALUES (?, ?, ?, ?, ?, ?)";

    static final String DELETE_ITEM_SQL = "DELETE FROM order_items WHERE order_id = ? AND item = ?";

    static final String DELETE_ORPHAN_ORDERS_SQL = "DELETE FROM orders o WHERE NOT EXISTS"
            + " (SELECT 1 FROM order_items i WHERE i.order_id = o.order_id)";

    static final String TOTALS_BY_ORDER_SQL =
            "SELECT o.order_id, o.customer_id, SUM(i.quantity * i.unit_price) AS total_value"
                    + " FROM orders o JOIN order_items i ON o.order_id = i.order_id"
                    + " WHERE i.item <> ? AND i.quantity IS NOT NULL"
                    + " AND i.unit_price IS NOT NULL"
                    + " GROUP BY o.order_id, o.customer_id ORDER BY o.order_id";

    static final String TOP_CUSTOMER_SQL =
            "SELECT o.customer_id, SUM(i.quantity * i.unit_price) AS total_spend"
                    + " FROM orders o JOIN order_items i ON o.order_id = i.order_id"
                    + " WHERE i.quantity IS NOT NULL AND i.unit_price IS NOT NULL"
                    + " AND o.customer_id IS NOT NULL"
                    + " GROUP BY o.customer_id ORDER BY total_spend DESC, o.customer_id ASC"
                    + " FETCH FIRST 1 ROWS ONLY";

    static final String ITEM_COUNTS_SQL =
            "SELECT o.order_id, COUNT(DISTINCT i.item) AS unique_items"
                    + " FROM orders o JOIN order_items i ON o.order_id = i.order_id"
                    + " WHERE i.quantity IS NOT NULL GROUP BY o.order_id ORDER BY o.order_id";

    static final String INVALID_ITEMS_SQL =
            "SELECT order_id, item, quantity, unit_price, is_valid, error_message"
                    + " FROM order_items WHERE is_valid = FALSE ORDER BY id";

    static final String ACTIVE_ORDERS_SQL = "SELECT o.order_id, o.customer_id, o.order_date,"
            + " i.item, i.quantity, i.unit_price, i.is_valid, i.error_message"
            + " FROM orders o JOIN order_items i ON o.order_id = i.order_id"
            + " ORDER BY o.order_id, i.id";

    static final String CHILD_KEYS_SQL = "SELECT order_id, item FROM order_items ORDER BY id";

    static final String PARENT_IDS_SQL = "SELECT order_id FROM orders ORDER BY order_id";

    private final Connection jdbc;

    /**
     * Creates a store over a caller-managed connection.
     *
     * @param jdbc JDBC connection
     */
    public JdbcOrderStore(Connection jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void upsertParent(Order order) throws SQLException {
        try (PreparedStatement ps = jdbc.prepareStatement(UPSERT_ORDER_SQL)) {
            ps.setString(1, order.getOrderId());
            ps.setString(2, order.getCustomerId());
            if (order.getOrderDate() == null) {
                ps.setNull(3, Types.DATE);
            } else {
                ps.setObject(3, order.getOrderDate());
            }
            ps.executeUpdate();
        }
    }

    @Override
    public void upsertChild(OrderItem item) throws SQLException {
        try (PreparedStatement ps = jdbc.prepareStatement(UPSERT_ITEM_SQL)) {
            ps.setString(1, item.getOrderId());
            ps.setString(2, item.getItem());
            if (item.getQuantity() == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setInt(3, item.getQuantity());
            }
            if (item.getUnitPrice() == null) {
                ps.setNull(4, Types.DECIMAL);
            } else {
                ps.setBigDecimal(4, item.getUnitPrice());
            }
            ps.setBoolean(5, item.isValid());
            ps.setString(6, item.getErrorMessage());
            ps.executeUpdate();
        }
    }

    @Override
    public int deleteChildrenNotIn(Set<OrderKey> keys) throws SQLException {
        Set<OrderKey> stale = childKeys();
        stale.removeAll(keys);
        if (stale.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = jdbc.prepareStatement(DELETE_ITEM_SQL)) {
            for (OrderKey key : stale) {
                ps.setString(1, key.getOrderId());
                ps.setString(2, key.getItem());
                ps.addBatch();
                log.debug("Deleting item missing from batch: {}", key);
            }
            return Arrays.stream(ps.executeBatch()).sum();
        }
    }

    @Override
    public int deleteOrphanParents() throws SQLException {
        try (Statement stmt = jdbc.createStatement()) {
            return stmt.executeUpdate(DELETE_ORPHAN_ORDERS_SQL);
        }
    }

    @Override
    public void deleteAll() throws SQLException {
        try (Statement stmt = jdbc.createStatement()) {
            int items = stmt.executeUpdate("DELETE FROM order_items");
            int orders = stmt.executeUpdate("DELETE FROM orders");
            log.info("Cleared store (items={}, orders={})", items, orders);
        }
    }

    @Override
    public List<OrderTotal> totalsByOrder() throws SQLException {
        List<OrderTotal> totals = new ArrayList<>();
        try (PreparedStatement ps = jdbc.prepareStatement(TOTALS_BY_ORDER_SQL)) {
            ps.setString(1, OrderKey.PLACEHOLDER_ITEM);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    totals.add(new OrderTotal(rs.getString("order_id"),
                            rs.getString("customer_id"),
                            Decimals.normalize(rs.getBigDecimal("total_value"))));
                }
            }
        }
        return totals;
    }

    @Override
    public Optional<CustomerSpend> topCustomer() throws SQLException {
        try (Statement stmt = jdbc.createStatement();
                ResultSet rs = stmt.executeQuery(TOP_CUSTOMER_SQL)) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new CustomerSpend(rs.getString("customer_id"),
                    Decimals.normalize(rs.getBigDecimal("total_spend"))));
        }
    }

    @Override
    public List<ItemCount> distinctItemCountsByOrder() throws SQLException {
        List<ItemCount> counts = new ArrayList<>();
        try (Statement stmt = jdbc.createStatement();
                ResultSet rs = stmt.executeQuery(ITEM_COUNTS_SQL)) {
            while (rs.next()) {
                counts.add(new ItemCount(rs.getString("order_id"), rs.getInt("unique_items")));
            }
        }
        return counts;
    }

    @Override
    public List<OrderItem> invalidChildren() throws SQLException {
        List<OrderItem> items = new ArrayList<>();
        try (Statement stmt = jdbc.createStatement();
                ResultSet rs = stmt.executeQuery(INVALID_ITEMS_SQL)) {
            while (rs.next()) {
                items.add(readItem(rs));
            }
        }
        return items;
    }

    @Override
    public List<OrderWithItems> allActiveOrdersWithItems() throws SQLException {
        Map<String, Order> orders = new LinkedHashMap<>();
        Map<String, List<OrderItem>> itemsByOrder = new LinkedHashMap<>();
        try (Statement stmt = jdbc.createStatement();
                ResultSet rs = stmt.executeQuery(ACTIVE_ORDERS_SQL)) {
            while (rs.next()) {
                String orderId = rs.getString("order_id");
                if (!orders.containsKey(orderId)) {
                    orders.put(orderId, new Order(orderId, rs.getString("customer_id"),
                            rs.getObject("order_date", LocalDate.class)));
                }
                itemsByOrder.computeIfAbsent(orderId, id -> new ArrayList<>()).add(readItem(rs));
            }
        }
        List<OrderWithItems> result = new ArrayList<>(orders.size());
        orders.forEach((id, order) -> result.add(new OrderWithItems(order, itemsByOrder.get(id))));
        return result;
    }

    @Override
    public Set<OrderKey> childKeys() throws SQLException {
        Set<OrderKey> keys = new LinkedHashSet<>();
        try (Statement stmt = jdbc.createStatement();
                ResultSet rs = stmt.executeQuery(CHILD_KEYS_SQL)) {
            while (rs.next()) {
                keys.add(new OrderKey(rs.getString("order_id"), rs.getString("item")));
            }
        }
        return keys;
    }

    @Override
    public Set<String> parentIds() throws SQLException {
        Set<String> ids = new LinkedHashSet<>();
        try (Statement stmt = jdbc.createStatement();
                ResultSet rs = stmt.executeQuery(PARENT_IDS_SQL)) {
            while (rs.next()) {
                ids.add(rs.getString("order_id"));
            }
        }
        return ids;
    }

    private static OrderItem readItem(ResultSet rs) throws SQLException {
        int quantity = rs.getInt("quantity");
        Integer boxedQuantity = rs.wasNull() ? null : quantity;
        return new OrderItem(rs.getString("order_id"), rs.getString("item"), boxedQuantity,
                Decimals.normalize(rs.getBigDecimal("unit_price")), rs.getBoolean("is_valid"),
                rs.getString("error_message"));
    }
}
