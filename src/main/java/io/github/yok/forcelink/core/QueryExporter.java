package io.github.yok.forcelink.core;

import com.google.common.annotations.VisibleForTesting;
import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.exception.ConfigException;
import io.github.yok.forcelink.exception.ForceLinkException;
import io.github.yok.forcelink.exception.TransportException;
import io.github.yok.forcelink.model.QueryPage;
import io.github.yok.forcelink.store.RemoteObjectStore;
import io.github.yok.forcelink.store.Session;
import io.github.yok.forcelink.store.SessionProvider;
import io.github.yok.forcelink.util.CsvUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;

/**
 * Exports the result of a query to a CSV file.
 *
 * <p>
 * Pages are followed until the store reports the last one. The header is the SELECT list of the
 * query, spelled as the first page spells it, so a relationship that is null on the first page
 * (e.g. {@code Account.Name}) keeps its column. Queries whose columns cannot be read from the text
 * ({@code FIELDS()}, subqueries, {@code TYPEOF}, unaliased functions) use the field order of the
 * first page. Later pages are written in the same order, with missing fields left blank. Rows
 * already written stay in the file when a later page fails.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class QueryExporter {

    private static final Pattern FIELD_PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern ALIASED_FUNCTION =
            Pattern.compile("[A-Za-z_]+\\s*\\(.*\\)\\s+([A-Za-z_][A-Za-z0-9_]*)");

    private final RemoteObjectStore store;
    private final SessionProvider sessionProvider;
    private final CsvSettings csvSettings;

    /**
     * Runs a query and writes every row to {@code output}.
     *
     * @param soql query text
     * @param output destination file; parent directories are created
     * @return number of rows written
     * @throws io.github.yok.forcelink.exception.QueryException if the store rejects the query
     */
    public int export(String soql, Path output) {
        if (StringUtils.isBlank(soql)) {
            throw new ConfigException("Query is required.");
        }
        if (output == null) {
            throw new ConfigException("Output file is required.");
        }
        log.info("Running query: {}", soql);
        QueryPage page = fetch(session -> store.query(session, soql));
        if (page.getRecords().isEmpty() && page.isDone()) {
            writeEmpty(output);
            log.info("Query returned no rows; created empty file {}", output);
            return 0;
        }

        List<String> header = header(soql, page.getFieldNames());
        log.debug("Columns: {}", header);
        int count = 0;
        try (CSVPrinter printer = CsvUtils.createPrinter(output, csvSettings, header)) {
            while (true) {
                for (Map<String, String> record : page.getRecords()) {
                    // field names are case-insensitive; the query text may spell them differently
                    Map<String, String> byField = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                    byField.putAll(record);
                    List<String> values = new ArrayList<>(header.size());
                    for (String field : header) {
                        values.add(byField.getOrDefault(field, ""));
                    }
                    printer.printRecord(values);
                    count++;
                }
                printer.flush();
                log.debug("{} row(s) written so far", count);
                if (page.isDone()) {
                    break;
                }
                String next = page.getNextToken();
                page = fetch(session -> store.queryMore(session, next));
            }
        } catch (IOException e) {
            throw new ForceLinkException("Failed to write query results to " + output, e);
        }
        log.info("Exported {} row(s) to {}", count, output);
        return count;
    }

    private static List<String> header(String soql, List<String> firstPageFields) {
        List<String> selected = selectedColumns(soql);
        if (selected.isEmpty()) {
            return firstPageFields;
        }
        List<String> header = new ArrayList<>(selected.size());
        for (String column : selected) {
            header.add(firstPageFields.stream().filter(column::equalsIgnoreCase).findFirst()
                    .orElse(column));
        }
        return header;
    }

    /**
     * Reads the result column names from the SELECT list of a query.
     *
     * @param soql query text
     * @return column names in SELECT order, or an empty list if they cannot be determined from the
     *         text alone
     */
    @VisibleForTesting
    static List<String> selectedColumns(String soql) {
        String text = soql.trim();
        if (text.length() < 7 || !text.regionMatches(true, 0, "SELECT", 0, 6)
                || !Character.isWhitespace(text.charAt(6))) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        StringBuilder item = new StringBuilder();
        int depth = 0;
        for (int i = 6; i < text.length(); i++) {
            char c = text.charAt(i);
            if (depth == 0 && Character.isWhitespace(c) && isFromKeyword(text, i + 1)) {
                items.add(item.toString().trim());
                return toColumns(items);
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
            if (c == ',' && depth == 0) {
                items.add(item.toString().trim());
                item.setLength(0);
            } else {
                item.append(c);
            }
        }
        return List.of();
    }

    private static boolean isFromKeyword(String text, int index) {
        int end = index + 4;
        return text.regionMatches(true, index, "FROM", 0, 4)
                && (end == text.length() || Character.isWhitespace(text.charAt(end)));
    }

    private static List<String> toColumns(List<String> items) {
        List<String> columns = new ArrayList<>(items.size());
        for (String item : items) {
            if (FIELD_PATH.matcher(item).matches()) {
                columns.add(item);
                continue;
            }
            Matcher aliased = ALIASED_FUNCTION.matcher(item);
            if (aliased.matches() && !StringUtils.startsWithIgnoreCase(item, "FIELDS")) {
                columns.add(aliased.group(1));
                continue;
            }
            return List.of();
        }
        return columns;
    }

    private QueryPage fetch(Function<Session, QueryPage> call) {
        try {
            return call.apply(sessionProvider.acquire());
        } catch (TransportException e) {
            if (!e.isSessionExpired()) {
                throw e;
            }
            log.warn("Session expired during query; logging in again");
            return call.apply(sessionProvider.reauthenticate());
        }
    }

    private static void writeEmpty(Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, new byte[0]);
        } catch (IOException e) {
            throw new ForceLinkException("Failed to create " + output, e);
        }
    }
}
