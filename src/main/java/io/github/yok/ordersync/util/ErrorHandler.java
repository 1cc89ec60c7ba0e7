package io.github.yok.ordersync.util;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal sync failure: logs it and echoes a concise, categorized message to
 * {@code System.err}.
 *
 * <p>
 * Every report names a {@link Failure} so that the operator can tell at a glance whether the
 * input file, the store, the JSON export or the settings need attention. Per-row validation
 * problems are data and never reach this class.
 * </p>
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error using SLF4J, prefixed with the failure label.</li>
 * <li>Writes {@code ERROR [<label>]: <message>} to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself; {@code Main} turns the failure into an exit code.</li>
 * <li>In tests, callers can switch behavior to throwing a {@link FatalErrorException} via
 * thread-local flags.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    /**
     * Category of a fatal failure.
     */
    @Getter
    @RequiredArgsConstructor
    public enum Failure {
        /** The CSV file is missing, unreadable or has no header row. */
        INPUT_SOURCE("Input source error"),
        /** Opening the store or running the sync transaction failed. */
        STORE("Store transaction error"),
        /** The JSON snapshot could not be written. */
        EXPORT("Export error"),
        /** A required setting is missing. */
        CONFIGURATION("Configuration error"),
        /** Anything that escaped the steps above. */
        UNEXPECTED("Unexpected error");

        private final String label;
    }

    /**
     * Thrown instead of reporting when exit is disabled for the current thread.
     */
    @Getter
    public static class FatalErrorException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        private final transient Failure failure;

        FatalErrorException(Failure failure, String message, Throwable cause) {
            super(message, cause);
            this.failure = failure;
        }
    }

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the given failure and its root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws a
     * {@link FatalErrorException} carrying {@code failure} instead.
     * </p>
     *
     * @param failure failure category
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(Failure failure, String message, Throwable cause) {
        log.error("[{}] {}\n{}", failure.getLabel(), message,
                ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new FatalErrorException(failure, message, cause);
        }
        System.err.println(banner(failure, message) + "\n"
                + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the given failure at error level and prints it to {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws a
     * {@link FatalErrorException} carrying {@code failure} instead.
     * </p>
     *
     * @param failure failure category
     * @param message message to log
     */
    public static void errorAndExit(Failure failure, String message) {
        log.error("[{}] {}", failure.getLabel(), message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new FatalErrorException(failure, message, null);
        }
        System.err.println(banner(failure, message));
    }

    private static String banner(Failure failure, String message) {
        return "ERROR [" + failure.getLabel() + "]: " + message;
    }
}
