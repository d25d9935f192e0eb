package io.github.yok.forcelink.sink;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.exception.ErrorSinkException;
import io.github.yok.forcelink.model.SourceRow;
import io.github.yok.forcelink.util.CsvUtils;
import io.github.yok.forcelink.util.RunFileNameResolver;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes {@code upload_success_<source>_<timestamp>.csv} into the result directory: the source
 * columns followed by {@code record_id}.
 */
@Slf4j
public class CsvSuccessSink implements SuccessSink {

    private final Path directory;
    private final CsvSettings settings;
    private final String sourceName;
    private final List<String> sourceColumns;
    private final RunFileNameResolver fileNameResolver;

    private CSVPrinter printer;
    private Path file;

    public CsvSuccessSink(Path directory, CsvSettings settings, String sourceName,
            List<String> sourceColumns, Clock clock) {
        this.directory = directory;
        this.settings = settings;
        this.sourceName = sourceName;
        this.sourceColumns = ImmutableList.copyOf(sourceColumns);
        this.fileNameResolver = new RunFileNameResolver(clock);
    }

    @Override
    public synchronized void record(SourceRow row, String recordId) {
        try {
            if (printer == null) {
                file = fileNameResolver.resolve(directory, "upload_success", sourceName);
                List<String> header = new ArrayList<>(sourceColumns);
                header.add("record_id");
                printer = CsvUtils.createPrinter(file, settings, header);
                log.info("Success file created: {}", file);
            }
            List<String> values = new ArrayList<>(sourceColumns.size() + 1);
            sourceColumns.forEach(column -> values.add(row.get(column)));
            values.add(Strings.nullToEmpty(recordId));
            printer.printRecord(values);
        } catch (IOException e) {
            throw new ErrorSinkException("Failed to write success record to " + file, e);
        }
    }

    public synchronized Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (printer == null) {
            return;
        }
        try {
            printer.close();
        } catch (IOException e) {
            throw new ErrorSinkException("Failed to close success file " + file, e);
        } finally {
            printer = null;
        }
    }
}
