package io.github.yok.ordersync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class PathsConfigTest {

    @Test
    void requireCsvPath_正常ケース_設定済みを指定する_値が返ること() {
        PathsConfig config = new PathsConfig();
        config.setCsvPath("user_data.csv");
        config.setExportPath("out.json");

        assertEquals("user_data.csv", config.requireCsvPath());
        assertEquals("out.json", config.requireExportPath());
        assertEquals(SyncMode.SYNC, config.getMode());
    }

    @Test
    void requireCsvPath_異常ケース_未設定を指定する_IllegalStateExceptionが送出されること() {
        PathsConfig config = new PathsConfig();
        config.setExportPath(" ");

        assertThrows(IllegalStateException.class, config::requireCsvPath);
        assertThrows(IllegalStateException.class, config::requireExportPath);
    }
}
