package io.github.yok.ordersync.db;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.ordersync.config.StoreConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreConnectionFactoryTest {

    @Test
    void open_正常ケース_上書きパスを指定する_H2ファイルが作成されること(@TempDir Path tempDir)
            throws Exception {
        StoreConfig config = new StoreConfig();
        config.setPath("unused");
        Path store = tempDir.resolve("pepper_orders");

        try (Connection jdbc = new StoreConnectionFactory(config).open(store.toString())) {
            assertFalse(jdbc.isClosed());
        }
        assertTrue(Files.exists(tempDir.resolve("pepper_orders.mv.db")));
    }

    @Test
    void open_正常ケース_URLを設定する_そのURLで接続されること() throws Exception {
        StoreConfig config = new StoreConfig();
        config.setUrl("jdbc:h2:mem:factory_url");

        try (Connection jdbc = new StoreConnectionFactory(config).open(null)) {
            assertTrue(jdbc.getMetaData().getURL().startsWith("jdbc:h2:mem:factory_url"));
        }
    }

    @Test
    void open_異常ケース_存在しないドライバを指定する_SQLExceptionが送出されること() {
        StoreConfig config = new StoreConfig();
        config.setUrl("jdbc:h2:mem:x");
        config.setDriverClass("com.example.MissingDriver");

        StoreConnectionFactory factory = new StoreConnectionFactory(config);
        SQLException ex = assertThrows(SQLException.class, () -> factory.open(null));
        assertTrue(ex.getMessage().contains("com.example.MissingDriver"));
    }
}
