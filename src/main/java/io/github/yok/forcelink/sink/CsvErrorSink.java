package io.github.yok.forcelink.sink;

import com.google.common.collect.ImmutableList;
import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.exception.ErrorSinkException;
import io.github.yok.forcelink.model.ErrorRecord;
import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.SourceRow;
import io.github.yok.forcelink.util.CsvUtils;
import io.github.yok.forcelink.util.RunFileNameResolver;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVPrinter;

/**
 * Error sink writing one CSV file per run.
 *
 * <p>
 * The file is created on the first failed record, so a run without failures leaves no file. Its
 * header is the source columns followed by {@code error_reason}, {@code failed_at} and
 * {@code source_operation}. Each record is flushed as soon as it is written.
 * </p>
 */
@Slf4j
public class CsvErrorSink implements ErrorSink {

    static final String ERROR_REASON = "error_reason";
    static final String FAILED_AT = "failed_at";
    static final String SOURCE_OPERATION = "source_operation";

    private final CsvSettings settings;
    private final String sourceName;
    private final List<String> sourceColumns;
    private final RunFileNameResolver fileNameResolver;
    private final Clock clock;

    private CSVPrinter printer;
    private Path file;
    private int count;

    /**
     * Creates a sink.
     *
     * @param settings CSV settings; the error directory is taken from here
     * @param sourceName source file name, used in the error file name
     * @param sourceColumns source header in order
     * @param clock clock for {@code failed_at} and the file name
     */
    public CsvErrorSink(CsvSettings settings, String sourceName, List<String> sourceColumns,
            Clock clock) {
        this.settings = settings;
        this.sourceName = sourceName;
        this.sourceColumns = ImmutableList.copyOf(sourceColumns);
        this.fileNameResolver = new RunFileNameResolver(clock);
        this.clock = clock;
    }

    @Override
    public synchronized void record(SourceRow row, String reason, Operation operation) {
        write(new ErrorRecord(row, reason == null ? "Unknown error" : reason,
                OffsetDateTime.now(clock), operation));
    }

    private void write(ErrorRecord record) {
        try {
            if (printer == null) {
                open();
            }
            List<String> values = new ArrayList<>(sourceColumns.size() + 3);
            for (String column : sourceColumns) {
                values.add(record.getRow().get(column));
            }
            values.add(record.getErrorReason());
            values.add(record.getFailedAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
            values.add(record.getSourceOperation().getLabel());
            printer.printRecord(values);
            printer.flush();
            count++;
        } catch (IOException e) {
            throw new ErrorSinkException("Failed to write error record for row "
                    + record.getRow().getRowNumber() + " to " + file, e);
        }
    }

    private void open() throws IOException {
        Path target = fileNameResolver.resolve(settings.getErrorDirectory(), "failed", sourceName);
        List<String> header = new ArrayList<>(sourceColumns);
        header.add(ERROR_REASON);
        header.add(FAILED_AT);
        header.add(SOURCE_OPERATION);
        printer = CsvUtils.createPrinter(target, settings, header);
        file = target;
        log.info("Error file created: {}", file);
    }

    @Override
    public synchronized int getCount() {
        return count;
    }

    @Override
    public synchronized Optional<Path> getFile() {
        return Optional.ofNullable(file);
    }

    @Override
    public synchronized void close() {
        if (printer == null) {
            return;
        }
        try {
            printer.close();
        } catch (IOException e) {
            throw new ErrorSinkException("Failed to close error file " + file, e);
        } finally {
            printer = null;
        }
    }
}
