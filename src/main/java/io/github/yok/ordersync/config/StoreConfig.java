package io.github.yok.ordersync.config;

import java.nio.file.Path;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the connection settings of the embedded order store, loaded from
 * the {@code ordersync.store} section of {@code application.yml}.
 *
 * <pre>
 * ordersync:
 *   store:
 *     path: pepper_orders
 *     url:
 *     user: sa
 *     password: ""
 *     driver-class: org.h2.Driver
 * </pre>
 *
 * <p>
 * When {@code url} is set it is used verbatim; otherwise an H2 file URL is composed from
 * {@code path}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "ordersync.store")
@Data
public class StoreConfig {

    // Suffix H2 appends to the database file name
    private static final String H2_FILE_SUFFIX = ".mv.db";

    // Database file path without the H2 suffix (e.g. "pepper_orders")
    private String path;
    // Explicit JDBC connection URL (e.g. jdbc:h2:mem:orders)
    private String url;
    // Database user name
    private String user = "sa";
    // Database password
    private String password = "";
    // Fully qualified JDBC driver class name
    private String driverClass = "org.h2.Driver";

    /**
     * Resolves the JDBC URL for the store.
     *
     * <p>
     * Resolution order: {@code pathOverride} (typically the {@code --store} option), then the
     * configured {@code url}, then the configured {@code path}. Paths are made absolute because H2
     * rejects paths implicitly relative to the working directory, and a trailing {@code .mv.db} is
     * dropped.
     * </p>
     *
     * @param pathOverride store path given on the command line, or {@code null}
     * @return JDBC URL
     * @throws IllegalStateException if neither a URL nor a path is available
     */
    public String resolveUrl(String pathOverride) {
        if (StringUtils.isNotBlank(pathOverride)) {
            return toH2FileUrl(pathOverride);
        }
        if (StringUtils.isNotBlank(url)) {
            return url.trim();
        }
        if (StringUtils.isNotBlank(path)) {
            return toH2FileUrl(path);
        }
        throw new IllegalStateException(
                "Store location is not configured. Set 'ordersync.store.path' or 'ordersync.store.url'.");
    }

    private static String toH2FileUrl(String storePath) {
        String trimmed = StringUtils.removeEndIgnoreCase(storePath.trim(), H2_FILE_SUFFIX);
        return "jdbc:h2:file:" + Path.of(trimmed).toAbsolutePath().normalize();
    }
}
