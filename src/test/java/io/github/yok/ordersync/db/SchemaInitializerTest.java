package io.github.yok.ordersync.db;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.Test;

class SchemaInitializerTest {

    @Test
    void initialize_正常ケース_2回実行する_エラーなくテーブルが存在すること() throws Exception {
        try (Connection jdbc = H2TestSupport.openMemoryStore()) {
            assertDoesNotThrow(() -> new SchemaInitializer().initialize(jdbc));

            ITable tables = H2TestSupport.query(jdbc,
                    "SELECT table_name FROM information_schema.tables"
                            + " WHERE table_name IN ('ORDERS', 'ORDER_ITEMS') ORDER BY table_name");
            assertEquals(2, tables.getRowCount());
        }
    }

    @Test
    void initialize_正常ケース_自動コミット無効で実行する_DDLがコミットされること() throws Exception {
        try (Connection jdbc = DriverManager.getConnection("jdbc:h2:mem:schema_tx", "sa", "")) {
            jdbc.setAutoCommit(false);
            new SchemaInitializer().initialize(jdbc);
            jdbc.rollback();

            try (Statement stmt = jdbc.createStatement()) {
                assertDoesNotThrow(() -> stmt.executeQuery("SELECT COUNT(*) FROM order_items"));
            }
        }
    }

    @Test
    void initialize_異常ケース_キーが重複する項目を挿入する_一意制約違反となること() throws Exception {
        try (Connection jdbc = H2TestSupport.openMemoryStore();
                Statement stmt = jdbc.createStatement()) {
            stmt.executeUpdate("INSERT INTO orders (order_id) VALUES ('1')");
            stmt.executeUpdate("INSERT INTO order_items (order_id, item, is_valid)"
                    + " VALUES ('1', 'Widget', TRUE)");

            assertThrows(SQLException.class,
                    () -> stmt.executeUpdate("INSERT INTO order_items (order_id, item, is_valid)"
                            + " VALUES ('1', 'Widget', FALSE)"));
        }
    }
}
