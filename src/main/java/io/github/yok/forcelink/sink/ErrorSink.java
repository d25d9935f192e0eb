package io.github.yok.forcelink.sink;

import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.SourceRow;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Append-only destination for records that ended in the failed state.
 *
 * <p>
 * A write failure is fatal: implementations throw
 * {@link io.github.yok.forcelink.exception.ErrorSinkException} rather than drop a failed record.
 * </p>
 */
public interface ErrorSink extends AutoCloseable {

    /**
     * Appends one failed record.
     *
     * @param row original source row
     * @param reason failure reason
     * @param operation operation the row was submitted with
     */
    void record(SourceRow row, String reason, Operation operation);

    /**
     * Returns the number of records written so far.
     *
     * @return record count
     */
    int getCount();

    /**
     * Returns the file written by this sink, if any record was written.
     *
     * @return error file
     */
    Optional<Path> getFile();

    @Override
    void close();
}
