package io.github.yok.ordersync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.ordersync.config.DateFormatProperties;
import io.github.yok.ordersync.config.PathsConfig;
import io.github.yok.ordersync.config.StoreConfig;
import io.github.yok.ordersync.config.SyncMode;
import io.github.yok.ordersync.core.OrderSyncPipeline;
import io.github.yok.ordersync.util.ErrorHandler;
import io.github.yok.ordersync.util.ErrorHandler.Failure;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private PathsConfig pathsConfig;
    private StoreConfig storeConfig;
    private DateFormatProperties dateFormatProperties;

    private Main main;

    @BeforeEach
    void setup() {
        pathsConfig = new PathsConfig();
        pathsConfig.setCsvPath("user_data.csv");
        pathsConfig.setExportPath("exported_orders.json");
        storeConfig = new StoreConfig();
        storeConfig.setPath("pepper_orders");
        dateFormatProperties = new DateFormatProperties();

        main = new Main(pathsConfig, storeConfig, dateFormatProperties);
    }

    @Test
    void run_正常ケース_引数なし_設定値の既定で同期が実行されること() {
        try (MockedConstruction<OrderSyncPipeline> mocked =
                Mockito.mockConstruction(OrderSyncPipeline.class, (mock, ctx) -> {
                    when(mock.run(any(), any(), any(), any())).thenReturn(true);
                    assertEquals(storeConfig, ctx.arguments().get(0));
                    assertEquals(dateFormatProperties, ctx.arguments().get(1));
                })) {

            main.run();

            OrderSyncPipeline pipeline = mocked.constructed().get(0);
            verify(pipeline).run(eq(Path.of("user_data.csv")), isNull(),
                    eq(Path.of("exported_orders.json")), eq(SyncMode.SYNC));
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_全オプションを指定する_指定値で上書きモードが実行されること() {
        try (MockedConstruction<OrderSyncPipeline> mocked =
                Mockito.mockConstruction(OrderSyncPipeline.class, (mock, ctx) -> when(
                        mock.run(any(), any(), any(), any())).thenReturn(true))) {

            main.run("--csv", "in.csv", "--store", "data/store", "--out", "out/o.json",
                    "--overwrite");

            verify(mocked.constructed().get(0)).run(eq(Path.of("in.csv")), eq("data/store"),
                    eq(Path.of("out/o.json")), eq(SyncMode.OVERWRITE));
        }
    }

    @Test
    void run_正常ケース_短縮オプションを指定する_指定値で実行されること() {
        try (MockedConstruction<OrderSyncPipeline> mocked =
                Mockito.mockConstruction(OrderSyncPipeline.class, (mock, ctx) -> when(
                        mock.run(any(), any(), any(), any())).thenReturn(true))) {

            main.run("-c", "a.csv", "-s", "st", "-o", "b.json", "-w", "--sync");

            verify(mocked.constructed().get(0)).run(eq(Path.of("a.csv")), eq("st"),
                    eq(Path.of("b.json")), eq(SyncMode.SYNC));
        }
    }

    @Test
    void run_正常ケース_設定で上書きモードを指定する_上書きモードで実行されること() {
        pathsConfig.setMode(SyncMode.OVERWRITE);
        try (MockedConstruction<OrderSyncPipeline> mocked =
                Mockito.mockConstruction(OrderSyncPipeline.class)) {

            main.run("--unknown");

            verify(mocked.constructed().get(0)).run(any(), isNull(), any(),
                    eq(SyncMode.OVERWRITE));
        }
    }

    @Test
    void run_異常ケース_パイプラインが失敗する_終了コードが1となること() {
        try (MockedConstruction<OrderSyncPipeline> mocked =
                Mockito.mockConstruction(OrderSyncPipeline.class, (mock, ctx) -> when(
                        mock.run(any(), any(), any(), any())).thenReturn(false))) {

            main.run();

            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_CSVパスが未設定_ErrorHandlerが呼ばれ終了コードが1となること() {
        Main sut = new Main(new PathsConfig(), storeConfig, dateFormatProperties);

        try (MockedStatic<ErrorHandler> mocked = Mockito.mockStatic(ErrorHandler.class)) {
            mocked.when(() -> ErrorHandler.errorAndExit(any(Failure.class), anyString(),
                    any(Throwable.class))).thenAnswer(inv -> {
                        throw new IllegalStateException("exit");
                    });

            assertThrows(IllegalStateException.class, () -> sut.run());

            mocked.verify(() -> ErrorHandler.errorAndExit(eq(Failure.CONFIGURATION),
                    startsWith("csv-path"), any(Throwable.class)));
            assertEquals(1, sut.getExitCode());
        }
    }

    @Test
    void run_異常ケース_パイプラインが実行時例外を送出する_想定外のエラーとして報告されること() {
        try (MockedStatic<ErrorHandler> handler = Mockito.mockStatic(ErrorHandler.class);
                MockedConstruction<OrderSyncPipeline> mocked =
                        Mockito.mockConstruction(OrderSyncPipeline.class, (mock, ctx) -> when(
                                mock.run(any(), any(), any(), any()))
                                .thenThrow(new IllegalArgumentException("boom")))) {

            main.run();

            handler.verify(() -> ErrorHandler.errorAndExit(eq(Failure.UNEXPECTED),
                    eq("Fatal error: boom"), any(IllegalArgumentException.class)));
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_オプション値が欠落_設定値が使われること() {
        try (MockedConstruction<OrderSyncPipeline> mocked =
                Mockito.mockConstruction(OrderSyncPipeline.class, (mock, ctx) -> when(
                        mock.run(any(), any(), any(), any())).thenReturn(true))) {

            main.run("--csv");

            verify(mocked.constructed().get(0)).run(eq(Path.of("user_data.csv")), isNull(),
                    any(), any());
            assertEquals(0, main.getExitCode());
        }
    }
}
