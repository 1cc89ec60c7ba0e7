package io.github.yok.ordersync.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.yok.ordersync.db.OrderStore;
import io.github.yok.ordersync.model.OrderWithItems;
import io.github.yok.ordersync.util.LogPathUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Builds the JSON snapshot of all active orders.
 *
 * <p>
 * The output is a pretty-printed array with one element per order that has at least one item:
 * </p>
 *
 * <pre>
 * [ {
 *   "order_id" : "1",
 *   "customer_id" : "C1",
 *   "date" : "2025-06-01",
 *   "total_price" : 19.98,
 *   "items" : [ { "item" : "Widget", "quantity" : 2, "unit_price" : 9.99,
 *                 "is_valid" : true, "error_message" : null } ]
 * } ]
 * </pre>
 *
 * <p>
 * Invalid items are exported for review; only billable items count towards
 * {@code total_price}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonOrderExporter {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    /**
     * Renders the snapshot as a JSON string.
     *
     * @param store order store
     * @return JSON array
     * @throws SQLException on DB error
     * @throws IOException if serialization fails
     */
    public String export(OrderStore store) throws SQLException, IOException {
        return mapper.writeValueAsString(project(store.allActiveOrdersWithItems()));
    }

    /**
     * Writes the snapshot to a UTF-8 file, creating parent directories as needed.
     *
     * @param store order store
     * @param target destination file (overwritten)
     * @return number of exported orders
     * @throws SQLException on DB error
     * @throws IOException if the file cannot be written
     */
    public int exportToFile(OrderStore store, Path target) throws SQLException, IOException {
        List<ExportedOrder> orders = project(store.allActiveOrdersWithItems());
        FileUtils.writeStringToFile(target.toFile(), mapper.writeValueAsString(orders),
                StandardCharsets.UTF_8);
        log.info("JSON saved to {} (orders={})", LogPathUtil.renderPathForLog(target),
                orders.size());
        return orders.size();
    }

    private static List<ExportedOrder> project(List<OrderWithItems> snapshots) {
        return snapshots.stream().map(ExportedOrder::of).collect(Collectors.toList());
    }
}
