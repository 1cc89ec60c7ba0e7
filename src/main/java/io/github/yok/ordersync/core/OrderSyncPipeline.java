package io.github.yok.ordersync.core;

import io.github.yok.ordersync.config.DateFormatProperties;
import io.github.yok.ordersync.config.StoreConfig;
import io.github.yok.ordersync.config.SyncMode;
import io.github.yok.ordersync.db.JdbcOrderStore;
import io.github.yok.ordersync.db.OrderStore;
import io.github.yok.ordersync.db.SchemaInitializer;
import io.github.yok.ordersync.db.StoreConnectionFactory;
import io.github.yok.ordersync.export.JsonOrderExporter;
import io.github.yok.ordersync.model.AggregationReport;
import io.github.yok.ordersync.model.SyncResult;
import io.github.yok.ordersync.model.ValidatedRecord;
import io.github.yok.ordersync.model.ValidationSummary;
import io.github.yok.ordersync.parser.OrderCsvReader;
import io.github.yok.ordersync.util.ErrorHandler;
import io.github.yok.ordersync.util.ErrorHandler.Failure;
import io.github.yok.ordersync.util.LogPathUtil;
import io.github.yok.ordersync.validation.FlexibleDateParser;
import io.github.yok.ordersync.validation.RowValidator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one end-to-end pass: read and validate the CSV, reconcile the store, report aggregations
 * and export the JSON snapshot.
 *
 * <p>
 * <strong>Steps:</strong>
 * </p>
 * <ol>
 * <li>Read the whole CSV into memory, validating every row and flagging duplicates.</li>
 * <li>Log the validation summary. Rows without an order id cannot be keyed: each one is logged
 * with its fields and error and left out of the store.</li>
 * <li>Open the store, create the schema if missing and reconcile the batch in one
 * transaction.</li>
 * <li>Log invalid items and the aggregations, then write the JSON snapshot.</li>
 * </ol>
 *
 * <p>
 * A missing or unreadable CSV file, a failed store operation or a failed export is fatal: it is
 * reported through {@link ErrorHandler} under its {@link Failure} category and {@link #run}
 * returns {@code false}. Bad rows are never fatal.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class OrderSyncPipeline {

    private final OrderCsvReader csvReader;
    private final StoreConnectionFactory connectionFactory;
    private final SchemaInitializer schemaInitializer;
    private final OrderReconciler reconciler;
    private final OrderAggregator aggregator;
    private final JsonOrderExporter exporter;
    private final SummaryReporter reporter;

    // Factory function to bind an OrderStore to the run's connection
    private final Function<Connection, ? extends OrderStore> storeFactory;

    /**
     * Creates a pipeline with the default JDBC store.
     *
     * @param storeConfig store settings
     * @param dateFormats accepted date formats
     */
    public OrderSyncPipeline(StoreConfig storeConfig, DateFormatProperties dateFormats) {
        this(new OrderCsvReader(new RowValidator(new FlexibleDateParser(dateFormats))),
                new StoreConnectionFactory(storeConfig), JdbcOrderStore::new);
    }

    /**
     * Creates a pipeline over the given collaborators.
     *
     * @param csvReader CSV reader
     * @param connectionFactory store connection factory
     * @param storeFactory creates the store view over a JDBC connection
     */
    public OrderSyncPipeline(OrderCsvReader csvReader, StoreConnectionFactory connectionFactory,
            Function<Connection, ? extends OrderStore> storeFactory) {
        this.csvReader = csvReader;
        this.connectionFactory = connectionFactory;
        this.storeFactory = storeFactory;
        this.schemaInitializer = new SchemaInitializer();
        this.reconciler = new OrderReconciler(storeFactory);
        this.aggregator = new OrderAggregator();
        this.exporter = new JsonOrderExporter();
        this.reporter = new SummaryReporter();
    }

    /**
     * Executes the pipeline.
     *
     * @param csvPath CSV file to import
     * @param storePath store path override, or {@code null} to use the configuration
     * @param exportPath JSON destination
     * @param mode write mode
     * @return {@code true} if the run completed, {@code false} after a fatal error
     */
    public boolean run(Path csvPath, String storePath, Path exportPath, SyncMode mode) {
        log.info("=== Order sync started (csv={}, mode={}) ===",
                LogPathUtil.renderPathForLog(csvPath), mode);

        if (!Files.isRegularFile(csvPath)) {
            ErrorHandler.errorAndExit(Failure.INPUT_SOURCE,
                    "CSV file not found: " + LogPathUtil.renderPathForLog(csvPath));
            return false;
        }

        List<ValidatedRecord> records;
        try (Stream<ValidatedRecord> stream = csvReader.read(csvPath)) {
            records = stream.collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            ErrorHandler.errorAndExit(Failure.INPUT_SOURCE,
                    "Failed to read CSV file: " + LogPathUtil.renderPathForLog(csvPath), e);
            return false;
        }

        reporter.reportValidation(ValidationSummary.of(records));
        Map<Boolean, List<ValidatedRecord>> byKey = records.stream()
                .collect(Collectors.partitioningBy(ValidatedRecord::hasOrderId));
        List<ValidatedRecord> keyed = byKey.get(Boolean.TRUE);
        reporter.reportUnkeyedRows(byKey.get(Boolean.FALSE));

        try (Connection jdbc = connectionFactory.open(storePath)) {
            schemaInitializer.initialize(jdbc);

            SyncResult syncResult = reconciler.reconcile(jdbc, keyed, mode);
            reporter.reportSync(syncResult);

            OrderStore store = storeFactory.apply(jdbc);
            reporter.reportInvalidItems(store.invalidChildren());
            AggregationReport report = aggregator.aggregate(store);
            reporter.reportAggregations(report);

            exporter.exportToFile(store, exportPath);
        } catch (IOException e) {
            ErrorHandler.errorAndExit(Failure.EXPORT, "Failed to write JSON export: "
                    + LogPathUtil.renderPathForLog(exportPath), e);
            return false;
        } catch (SQLException | RuntimeException e) {
            ErrorHandler.errorAndExit(Failure.STORE, "Order sync failed: " + e.getMessage(), e);
            return false;
        }

        log.info("=== Order sync completed ===");
        return true;
    }
}
