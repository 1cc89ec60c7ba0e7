package io.github.yok.ordersync;

import io.github.yok.ordersync.config.DateFormatProperties;
import io.github.yok.ordersync.config.PathsConfig;
import io.github.yok.ordersync.config.StoreConfig;
import io.github.yok.ordersync.config.SyncMode;
import io.github.yok.ordersync.core.OrderSyncPipeline;
import io.github.yok.ordersync.util.ErrorHandler;
import io.github.yok.ordersync.util.ErrorHandler.Failure;
import java.nio.file.Path;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options and invokes {@link OrderSyncPipeline}.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --csv <file>} or {@code -c <file>}: CSV file to import. Defaults to
 * {@code ordersync.csv-path}.</li>
 * <li>{@code --store <path>} or {@code -s <path>}: H2 database file. Defaults to
 * {@code ordersync.store.path} (or {@code ordersync.store.url}).</li>
 * <li>{@code --out <file>} or {@code -o <file>}: JSON destination. Defaults to
 * {@code ordersync.export-path}.</li>
 * <li>{@code --overwrite} or {@code -w}: replace the store contents instead of syncing.</li>
 * <li>{@code --sync}: incremental sync (the default unless {@code ordersync.mode} says
 * otherwise).</li>
 * </ul>
 *
 * <p>
 * The process exits with {@code 0} after a completed run and {@code 1} after a fatal error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see StoreConfig
 * @see DateFormatProperties
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, StoreConfig.class,
        DateFormatProperties.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final PathsConfig pathsConfig;
    private final StoreConfig storeConfig;
    private final DateFormatProperties dateFormatProperties;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the run's exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String csvPath = null;
        String storePath = null;
        String exportPath = null;
        SyncMode mode = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--csv":
                case "-c":
                    csvPath = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--store":
                case "-s":
                    storePath = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--out":
                case "-o":
                    exportPath = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--overwrite":
                case "-w":
                    mode = SyncMode.OVERWRITE;
                    break;
                case "--sync":
                    mode = SyncMode.SYNC;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        try {
            // Defaults
            if (csvPath == null) {
                csvPath = pathsConfig.requireCsvPath();
            }
            if (exportPath == null) {
                exportPath = pathsConfig.requireExportPath();
            }
        } catch (IllegalStateException e) {
            exitCode = 1;
            ErrorHandler.errorAndExit(Failure.CONFIGURATION, e.getMessage(), e);
            return;
        }
        if (mode == null) {
            mode = pathsConfig.getMode() == null ? SyncMode.SYNC : pathsConfig.getMode();
        }
        log.info("CSV: {}, Store: {}, Export: {}, Mode: {}", csvPath,
                storePath == null ? "(configured)" : storePath, exportPath, mode);

        try {
            boolean completed = new OrderSyncPipeline(storeConfig, dateFormatProperties)
                    .run(Path.of(csvPath), storePath, Path.of(exportPath), mode);
            exitCode = completed ? 0 : 1;
        } catch (RuntimeException e) {
            exitCode = 1;
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            ErrorHandler.errorAndExit(Failure.UNEXPECTED, "Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
