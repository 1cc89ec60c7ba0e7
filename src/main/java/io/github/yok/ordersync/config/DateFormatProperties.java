package io.github.yok.ordersync.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Property class that holds the date patterns accepted in the {@code date} column of the input
 * CSV.
 *
 * <p>
 * Specify the patterns under {@code ordersync.date.formats} in {@code application.yml}. They are
 * tried in the listed order and the first successful match wins. Patterns use
 * {@link java.time.format.DateTimeFormatter} syntax and are resolved strictly, so {@code uuuu}
 * must be used for the year.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "ordersync.date")
@Getter
@Setter
@NoArgsConstructor
public class DateFormatProperties {

    /**
     * Default patterns: ISO, day/month/year, year/month/day and full month name.
     */
    public static final List<String> DEFAULT_FORMATS =
            List.of("uuuu-M-d", "d/M/uuuu", "uuuu/M/d", "MMMM d uuuu");

    /**
     * Ordered list of accepted date patterns.
     *
     * <p>
     * Example: {@code [uuuu-M-d, d/M/uuuu]}
     * </p>
     */
    private List<String> formats = new ArrayList<>(DEFAULT_FORMATS);

}
