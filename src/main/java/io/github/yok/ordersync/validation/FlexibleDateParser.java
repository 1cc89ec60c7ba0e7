package io.github.yok.ordersync.validation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.ordersync.config.DateFormatProperties;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses the {@code date} column against an ordered list of patterns.
 *
 * <p>
 * Parsing is case-insensitive, uses English month names and resolves strictly, so impossible
 * dates such as {@code 2025-02-30} are rejected rather than adjusted. The first pattern that
 * matches the whole (trimmed) input wins.
 * </p>
 *
 * <p>
 * The class is stateless and thread-safe once constructed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FlexibleDateParser {

    private final List<DateTimeFormatter> formatters;

    /**
     * Creates a parser using the default patterns of {@link DateFormatProperties}.
     */
    public FlexibleDateParser() {
        this(DateFormatProperties.DEFAULT_FORMATS);
    }

    /**
     * Creates a parser from configured patterns.
     *
     * @param props date format properties
     * @throws IllegalArgumentException if any pattern is invalid or the list is empty
     */
    public FlexibleDateParser(DateFormatProperties props) {
        this(props.getFormats());
    }

    /**
     * Creates a parser from explicit patterns.
     *
     * @param patterns ordered patterns in {@link DateTimeFormatter} syntax
     * @throws IllegalArgumentException if any pattern is invalid or the list is empty
     */
    public FlexibleDateParser(List<String> patterns) {
        Preconditions.checkArgument(patterns != null && !patterns.isEmpty(),
                "At least one date format must be configured");
        ImmutableList.Builder<DateTimeFormatter> builder = ImmutableList.builder();
        for (String pattern : patterns) {
            builder.add(new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendPattern(pattern).toFormatter(Locale.ENGLISH)
                    .withResolverStyle(ResolverStyle.STRICT));
        }
        this.formatters = builder.build();
    }

    /**
     * Parses a date string.
     *
     * @param value raw CSV value
     * @return parsed date, or {@code null} if the value is blank or matches no pattern
     */
    public LocalDate parse(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        for (DateTimeFormatter formatter : formatters) {
            try {
                return LocalDate.parse(trimmed, formatter);
            } catch (DateTimeParseException e) {
                // try the next pattern
            }
        }
        log.debug("Unparseable date value: [{}]", trimmed);
        return null;
    }
}
