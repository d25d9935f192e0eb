package io.github.yok.forcelink.util;

import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.model.SourceRow;
import io.github.yok.forcelink.model.SourceTable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.io.input.BOMInputStream;

/**
 * Utility class for reading and writing CSV files.
 *
 * <p>
 * All files use the character set and delimiter of the supplied {@link CsvSettings}. Output uses
 * minimal quoting and the platform line separator; a UTF-8 byte order mark on input is skipped.
 * </p>
 */
public final class CsvUtils {

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Builds the output format for the given header.
     *
     * @param settings CSV settings
     * @param headers header columns, or {@code null} to write no header
     * @return CSV format
     */
    public static CSVFormat outputFormat(CsvSettings settings, String[] headers) {
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
                .setDelimiter(settings.getDelimiter()).setQuoteMode(QuoteMode.MINIMAL)
                .setRecordSeparator(System.lineSeparator());
        if (headers != null) {
            builder.setHeader(headers);
        }
        return builder.get();
    }

    /**
     * Reads a whole source file. The first record is the header; every following record becomes a
     * {@link SourceRow} numbered from 1. Short records are padded with empty strings.
     *
     * @param file source file
     * @param settings CSV settings
     * @return header and rows
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the header is empty or contains duplicate names
     */
    public static SourceTable readTable(Path file, CsvSettings settings) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setDelimiter(settings.getDelimiter())
                .setHeader().setSkipHeaderRecord(true).setAllowDuplicateHeaderNames(false)
                .setIgnoreSurroundingSpaces(false).get();
        try (InputStream in = BOMInputStream.builder()
                .setInputStream(Files.newInputStream(file)).get();
                Reader reader = new InputStreamReader(in, settings.getCharset());
                CSVParser parser = CSVParser.builder().setReader(reader).setFormat(fmt).get()) {
            List<String> header = parser.getHeaderNames();
            if (header.isEmpty()) {
                throw new IllegalArgumentException("CSV file has no header: " + file);
            }
            List<SourceRow> rows = new ArrayList<>();
            long rowNumber = 0;
            for (CSVRecord record : parser) {
                rowNumber++;
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < header.size(); i++) {
                    values.put(header.get(i), i < record.size() ? record.get(i) : "");
                }
                rows.add(new SourceRow(rowNumber, values));
            }
            return new SourceTable(header, rows);
        }
    }

    /**
     * Opens a printer on a new file, creating missing parent directories and writing the header.
     *
     * @param file destination; an existing file is truncated
     * @param settings CSV settings
     * @param headers header columns
     * @return printer positioned after the header
     * @throws IOException if the file cannot be created
     */
    public static CSVPrinter createPrinter(Path file, CsvSettings settings, List<String> headers)
            throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Writer writer = Files.newBufferedWriter(file, settings.getCharset(),
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        return new CSVPrinter(writer, outputFormat(settings, headers.toArray(new String[0])));
    }

    /**
     * Opens a printer appending to an existing file; no header is written.
     *
     * @param file existing file
     * @param settings CSV settings
     * @return printer positioned at the end of the file
     * @throws IOException if the file cannot be opened
     */
    public static CSVPrinter appendPrinter(Path file, CsvSettings settings) throws IOException {
        Writer writer = Files.newBufferedWriter(file, settings.getCharset(),
                StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        return new CSVPrinter(writer, outputFormat(settings, null));
    }
}
