package io.github.yok.ordersync.parser;

import io.github.yok.ordersync.model.ValidatedRecord;
import io.github.yok.ordersync.validation.DuplicateDetector;
import io.github.yok.ordersync.validation.RowValidator;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads an ERP order CSV export and produces a lazy sequence of {@link ValidatedRecord}s.
 *
 * <p>
 * The first record must be a header. Header names are matched case-insensitively and
 * space-insensitively against the canonical column names ({@code " Unit Price "} maps to
 * {@code unit_price}); unknown columns are ignored and short rows leave the missing cells absent.
 * A UTF-8 byte-order mark is skipped.
 * </p>
 *
 * <p>
 * Each record goes through {@link RowValidator} and then a per-call {@link DuplicateDetector}, in
 * file order, so the first occurrence of a key stays canonical. The returned stream owns the file
 * handle and must be closed; it can be consumed only once.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class OrderCsvReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setHeader()
            .setSkipHeaderRecord(true).setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL).setIgnoreEmptyLines(true)
            .get();

    private final RowValidator validator;

    /**
     * Creates a reader.
     *
     * @param validator row validator
     */
    public OrderCsvReader(RowValidator validator) {
        this.validator = validator;
    }

    /**
     * Opens the CSV file and returns its validated rows.
     *
     * @param csvFile CSV file
     * @return lazy stream of validated records; close it to release the file
     * @throws IOException if the file cannot be opened or has no header row
     */
    public Stream<ValidatedRecord> read(Path csvFile) throws IOException {
        InputStream in = BOMInputStream.builder().setInputStream(Files.newInputStream(csvFile))
                .get();
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        CSVParser parser;
        try {
            parser = CSVParser.parse(reader, FORMAT);
        } catch (IOException | UncheckedIOException e) {
            reader.close();
            throw e;
        }

        List<String> headers = parser.getHeaderNames();
        if (headers.isEmpty()) {
            parser.close();
            throw new IOException("CSV header row is missing: " + csvFile);
        }
        List<String> normalized =
                headers.stream().map(OrderCsvReader::normalizeHeader).collect(Collectors.toList());
        log.debug("CSV headers {} normalized to {}", headers, normalized);

        DuplicateDetector detector = new DuplicateDetector();
        return StreamSupport.stream(parser.spliterator(), false)
                .map(record -> toRow(record, normalized)).map(validator::validate)
                .map(detector::check).onClose(() -> {
                    try {
                        parser.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to close CSV file: " + csvFile, e);
                    }
                });
    }

    /**
     * Normalizes a header name: trimmed, lower-cased, inner spaces replaced by underscores.
     *
     * @param header raw header name
     * @return normalized name ({@code ""} for {@code null})
     */
    static String normalizeHeader(String header) {
        return StringUtils.trimToEmpty(header).toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private static Map<String, String> toRow(CSVRecord record, List<String> headers) {
        Map<String, String> row = new HashMap<>();
        int size = Math.min(record.size(), headers.size());
        for (int i = 0; i < size; i++) {
            // first column wins when a normalized name repeats
            row.putIfAbsent(headers.get(i), record.get(i));
        }
        return row;
    }
}
