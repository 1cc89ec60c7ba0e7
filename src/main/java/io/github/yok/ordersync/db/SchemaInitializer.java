package io.github.yok.ordersync.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the {@code orders} and {@code order_items} tables if they do not exist.
 *
 * <p>
 * Safe to run on every start. Schema migration between versions is not handled.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaInitializer {

    static final List<String> DDL = List.of(
            "CREATE TABLE IF NOT EXISTS orders ("
                    + " order_id VARCHAR NOT NULL PRIMARY KEY,"
                    + " customer_id VARCHAR,"
                    + " order_date DATE)",
            "CREATE TABLE IF NOT EXISTS order_items ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " order_id VARCHAR NOT NULL,"
                    + " item VARCHAR NOT NULL,"
                    + " quantity INTEGER,"
                    + " unit_price DECIMAL(30, 10),"
                    + " is_valid BOOLEAN NOT NULL,"
                    + " error_message VARCHAR,"
                    + " CONSTRAINT uq_order_items_key UNIQUE (order_id, item),"
                    + " CONSTRAINT fk_order_items_order FOREIGN KEY (order_id)"
                    + " REFERENCES orders (order_id))");

    /**
     * Executes the DDL on the given connection.
     *
     * @param jdbc JDBC connection
     * @throws SQLException on DB error
     */
    public void initialize(Connection jdbc) throws SQLException {
        try (Statement stmt = jdbc.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        }
        if (!jdbc.getAutoCommit()) {
            jdbc.commit();
        }
        log.info("Schema ready (orders, order_items)");
    }
}
