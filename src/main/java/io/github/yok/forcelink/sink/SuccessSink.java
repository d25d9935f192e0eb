package io.github.yok.forcelink.sink;

import io.github.yok.forcelink.model.SourceRow;

/**
 * Optional log of successfully written records.
 */
public interface SuccessSink extends AutoCloseable {

    /**
     * Sink that records nothing.
     */
    SuccessSink NONE = new SuccessSink() {
        @Override
        public void record(SourceRow row, String recordId) {
            // disabled
        }

        @Override
        public void close() {
            // nothing to close
        }
    };

    /**
     * Records one successful row.
     *
     * @param row original source row
     * @param recordId id returned by the remote store (may be {@code null})
     */
    void record(SourceRow row, String recordId);

    @Override
    void close();
}
