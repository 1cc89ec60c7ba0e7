package io.github.yok.ordersync.db;

import io.github.yok.ordersync.config.StoreConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens JDBC connections to the order store described by {@link StoreConfig}.
 *
 * <p>
 * A run opens exactly one connection and closes it when the run ends. H2 file databases are locked
 * exclusively while open; a second concurrent run against the same file is not supported.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class StoreConnectionFactory {

    private final StoreConfig storeConfig;

    /**
     * Creates a factory.
     *
     * @param storeConfig store settings
     */
    public StoreConnectionFactory(StoreConfig storeConfig) {
        this.storeConfig = storeConfig;
    }

    /**
     * Opens a connection.
     *
     * @param storePathOverride store path from the command line, or {@code null} to use the
     *        configuration
     * @return open connection; the caller must close it
     * @throws SQLException if the driver is missing or the database cannot be opened
     */
    public Connection open(String storePathOverride) throws SQLException {
        String url = storeConfig.resolveUrl(storePathOverride);
        try {
            Class.forName(storeConfig.getDriverClass());
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver not found: " + storeConfig.getDriverClass(), e);
        }
        log.info("Opening order store: {}", url);
        return DriverManager.getConnection(url, storeConfig.getUser(), storeConfig.getPassword());
    }
}
