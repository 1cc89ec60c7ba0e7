package io.github.yok.ordersync.db;

import io.github.yok.ordersync.model.CustomerSpend;
import io.github.yok.ordersync.model.ItemCount;
import io.github.yok.ordersync.model.Order;
import io.github.yok.ordersync.model.OrderItem;
import io.github.yok.ordersync.model.OrderKey;
import io.github.yok.ordersync.model.OrderTotal;
import io.github.yok.ordersync.model.OrderWithItems;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persisted order store: orders keyed by {@code order_id} and order items keyed by
 * {@code (order_id, item)}.
 *
 * <p>
 * Implementations do not manage transactions; the caller owns the transaction boundary.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface OrderStore {

    /**
     * Inserts the order, or overwrites {@code customer_id} and {@code order_date} if it exists.
     *
     * @param order order to write
     * @throws SQLException on DB error
     */
    void upsertParent(Order order) throws SQLException;

    /**
     * Inserts the item, or overwrites quantity, unit price, validity and error message if its key
     * exists. The key itself never changes.
     *
     * @param item item to write; its order must already exist
     * @throws SQLException on DB error
     */
    void upsertChild(OrderItem item) throws SQLException;

    /**
     * Deletes every item whose key is not contained in {@code keys}.
     *
     * @param keys keys to keep
     * @return number of deleted items
     * @throws SQLException on DB error
     */
    int deleteChildrenNotIn(Set<OrderKey> keys) throws SQLException;

    /**
     * Deletes every order that has no remaining item.
     *
     * @return number of deleted orders
     * @throws SQLException on DB error
     */
    int deleteOrphanParents() throws SQLException;

    /**
     * Deletes all items, then all orders.
     *
     * @throws SQLException on DB error
     */
    void deleteAll() throws SQLException;

    /**
     * Sums {@code quantity × unit_price} per order over priced, non-placeholder items.
     *
     * @return totals ordered by order id
     * @throws SQLException on DB error
     */
    List<OrderTotal> totalsByOrder() throws SQLException;

    /**
     * Returns the customer with the highest spend over all priced items, ties broken by the lowest
     * customer id.
     *
     * @return top customer, or empty if no item is priced
     * @throws SQLException on DB error
     */
    Optional<CustomerSpend> topCustomer() throws SQLException;

    /**
     * Counts distinct item names per order among items that have a quantity.
     *
     * @return counts ordered by order id
     * @throws SQLException on DB error
     */
    List<ItemCount> distinctItemCountsByOrder() throws SQLException;

    /**
     * Returns the items flagged invalid, in insertion order.
     *
     * @return invalid items
     * @throws SQLException on DB error
     */
    List<OrderItem> invalidChildren() throws SQLException;

    /**
     * Returns every order that has at least one item, with all of its items.
     *
     * @return orders ordered by order id, items in insertion order
     * @throws SQLException on DB error
     */
    List<OrderWithItems> allActiveOrdersWithItems() throws SQLException;

    /**
     * Returns the keys of all persisted items.
     *
     * @return item keys
     * @throws SQLException on DB error
     */
    Set<OrderKey> childKeys() throws SQLException;

    /**
     * Returns the ids of all persisted orders.
     *
     * @return order ids
     * @throws SQLException on DB error
     */
    Set<String> parentIds() throws SQLException;
}
