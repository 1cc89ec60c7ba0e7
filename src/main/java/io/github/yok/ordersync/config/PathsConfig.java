package io.github.yok.ordersync.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the file-related part of the {@code ordersync} section in
 * {@code application.yml}.
 *
 * <pre>
 * ordersync:
 *   csv-path: user_data.csv
 *   export-path: exported_orders.json
 *   mode: SYNC
 * </pre>
 *
 * <p>
 * Values given on the command line take precedence; these are the defaults used when an option is
 * omitted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "ordersync")
@Data
public class PathsConfig {

    // CSV file exported from the ERP system
    private String csvPath;

    // Destination of the JSON snapshot
    private String exportPath;

    // Default write mode when neither --sync nor --overwrite is given
    private SyncMode mode = SyncMode.SYNC;

    /**
     * Returns the configured CSV path.
     *
     * @return CSV path
     * @throws IllegalStateException if {@code csv-path} has not been set
     */
    public String requireCsvPath() {
        if (StringUtils.isBlank(csvPath)) {
            throw new IllegalStateException(
                    "csv-path is not configured. Please set 'ordersync.csv-path' in application.yml.");
        }
        return csvPath;
    }

    /**
     * Returns the configured export path.
     *
     * @return export path
     * @throws IllegalStateException if {@code export-path} has not been set
     */
    public String requireExportPath() {
        if (StringUtils.isBlank(exportPath)) {
            throw new IllegalStateException(
                    "export-path is not configured. Please set 'ordersync.export-path' in application.yml.");
        }
        return exportPath;
    }
}
