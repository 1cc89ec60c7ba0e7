package io.github.yok.ordersync.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.ordersync.util.ErrorHandler.Failure;
import io.github.yok.ordersync.util.ErrorHandler.FatalErrorException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_分類付きの例外が送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            SQLException cause = new SQLException("table locked");
            FatalErrorException ex = assertThrows(FatalErrorException.class,
                    () -> ErrorHandler.errorAndExit(Failure.STORE, "sync failed", cause));
            assertEquals("sync failed", ex.getMessage());
            assertEquals(Failure.STORE, ex.getFailure());
            assertSame(cause, ex.getCause());

            FatalErrorException ex2 = assertThrows(FatalErrorException.class,
                    () -> ErrorHandler.errorAndExit(Failure.INPUT_SOURCE,
                            "CSV file not found: x.csv"));
            assertEquals("CSV file not found: x.csv", ex2.getMessage());
            assertEquals(Failure.INPUT_SOURCE, ex2.getFailure());
            assertNull(ex2.getCause());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_exit有効で原因ありを指定する_分類と根本原因が標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.errorAndExit(Failure.STORE, "sync failed",
                    new IllegalStateException("wrapper", new SQLException("disk full")));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString();
        assertTrue(message.contains("ERROR [Store transaction error]: sync failed"));
        assertTrue(message.contains("disk full"));
    }

    @Test
    void errorAndExit_正常ケース_exit有効でメッセージのみを指定する_分類付きで標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.errorAndExit(Failure.INPUT_SOURCE, "CSV file not found: missing.csv");
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString()
                .contains("ERROR [Input source error]: CSV file not found: missing.csv"));
    }

    @Test
    void restoreExitForCurrentThread_正常ケース_復元後は例外が送出されないこと() {
        ErrorHandler.disableExitForCurrentThread();
        ErrorHandler.restoreExitForCurrentThread();
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.errorAndExit(Failure.EXPORT, "recoverable");
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString().contains("ERROR [Export error]: recoverable"));
    }
}
