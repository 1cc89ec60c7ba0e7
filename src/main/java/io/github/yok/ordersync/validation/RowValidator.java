package io.github.yok.ordersync.validation;

import io.github.yok.ordersync.model.ValidatedRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns one raw CSV row into a {@link ValidatedRecord}.
 *
 * <p>
 * Every field is checked; errors accumulate instead of short-circuiting and are joined with
 * {@code "; "} in field order. A row is valid only when all six required fields could be parsed.
 * </p>
 *
 * <ul>
 * <li>{@code customer_id}, {@code order_id}, {@code item}: trimmed, empty becomes missing</li>
 * <li>{@code quantity}: base-10 integer that fits an {@code int}</li>
 * <li>{@code unit_price}: decimal number (plain or exponent notation) with at most 20 integer
 * digits and 10 significant decimal places</li>
 * <li>{@code date}: see {@link FlexibleDateParser}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class RowValidator {

    public static final String CUSTOMER_ID = "customer_id";
    public static final String ORDER_ID = "order_id";
    public static final String ITEM = "item";
    public static final String QUANTITY = "quantity";
    public static final String UNIT_PRICE = "unit_price";
    public static final String DATE = "date";

    /**
     * Canonical column names, in validation order.
     */
    public static final List<String> FIELDS =
            List.of(CUSTOMER_ID, ORDER_ID, ITEM, QUANTITY, UNIT_PRICE, DATE);

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    // unit_price column is DECIMAL(30,10)
    private static final int MAX_PRICE_INTEGER_DIGITS = 20;
    private static final int MAX_PRICE_SCALE = 10;

    private final FlexibleDateParser dateParser;

    /**
     * Creates a validator.
     *
     * @param dateParser parser for the {@code date} column
     */
    public RowValidator(FlexibleDateParser dateParser) {
        this.dateParser = Objects.requireNonNull(dateParser, "dateParser must not be null");
    }

    /**
     * Validates one row.
     *
     * @param row raw values keyed by canonical column name; absent keys count as missing
     * @return validated record
     */
    public ValidatedRecord validate(Map<String, String> row) {
        List<String> errors = new ArrayList<>();

        String customerId = parseString(row.get(CUSTOMER_ID));
        if (customerId == null) {
            errors.add(missing(CUSTOMER_ID));
        }
        String orderId = parseString(row.get(ORDER_ID));
        if (orderId == null) {
            errors.add(missing(ORDER_ID));
        }
        String item = parseString(row.get(ITEM));
        if (item == null) {
            errors.add(missing(ITEM));
        }
        Integer quantity = parseInteger(row.get(QUANTITY));
        if (quantity == null) {
            errors.add(missing(QUANTITY));
        }
        BigDecimal unitPrice = parseDecimal(row.get(UNIT_PRICE));
        if (unitPrice == null) {
            errors.add(missing(UNIT_PRICE));
        }
        LocalDate date = dateParser.parse(row.get(DATE));
        if (date == null) {
            errors.add(missing(DATE));
        }

        boolean valid = errors.isEmpty();
        return new ValidatedRecord(customerId, orderId, item, quantity, unitPrice, date, valid,
                valid ? null : String.join("; ", errors));
    }

    /**
     * Runs the rules again over the typed fields of a record rendered back to text.
     *
     * <p>
     * A valid record comes back equal to itself. The duplicate verdict is not reproduced since it
     * depends on the rest of the batch.
     * </p>
     *
     * @param record previously validated record
     * @return freshly validated record
     */
    public ValidatedRecord revalidate(ValidatedRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(CUSTOMER_ID, record.getCustomerId());
        row.put(ORDER_ID, record.getOrderId());
        row.put(ITEM, record.getItem());
        row.put(QUANTITY, Objects.toString(record.getQuantity(), null));
        row.put(UNIT_PRICE,
                record.getUnitPrice() == null ? null : record.getUnitPrice().toPlainString());
        row.put(DATE, Objects.toString(record.getDate(), null));
        return validate(row);
    }

    private static String missing(String field) {
        return "Invalid or missing " + field;
    }

    static String parseString(String value) {
        return StringUtils.trimToNull(value);
    }

    static Integer parseInteger(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null || !INTEGER.matcher(trimmed).matches()) {
            return null;
        }
        try {
            return Integer.valueOf(trimmed);
        } catch (NumberFormatException e) {
            // out of int range
            return null;
        }
    }

    public static BigDecimal parseDecimal(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
        if (decimal.precision() - decimal.scale() > MAX_PRICE_INTEGER_DIGITS
                || decimal.stripTrailingZeros().scale() > MAX_PRICE_SCALE) {
            // the store would round or reject it
            return null;
        }
        return decimal;
    }
}
