package io.github.yok.forcelink.core;

import com.google.common.collect.Lists;
import io.github.yok.forcelink.config.RetryPolicy;
import io.github.yok.forcelink.exception.AuthException;
import io.github.yok.forcelink.exception.ConfigException;
import io.github.yok.forcelink.exception.PermanentApiException;
import io.github.yok.forcelink.exception.TransientApiException;
import io.github.yok.forcelink.exception.TransportException;
import io.github.yok.forcelink.model.Batch;
import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.OutcomeStatus;
import io.github.yok.forcelink.model.RecordOutcome;
import io.github.yok.forcelink.model.RecordState;
import io.github.yok.forcelink.model.SourceRow;
import io.github.yok.forcelink.model.SyncSummary;
import io.github.yok.forcelink.store.RemoteObjectStore;
import io.github.yok.forcelink.store.Session;
import io.github.yok.forcelink.store.SessionProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Splits mapped rows into chunks and submits them to the remote store one chunk at a time.
 *
 * <p>
 * <strong>Per chunk:</strong>
 * </p>
 * <ol>
 * <li>Records missing the key their operation requires fail without being submitted.</li>
 * <li>The remaining records are submitted as one {@link Batch}.</li>
 * <li>Records with a transient outcome are resubmitted together, with exponential backoff, until
 * they succeed, fail permanently, or {@link RetryPolicy#getMaxAttempts()} attempts are used
 * up.</li>
 * <li>A transport failure, while acquiring the session or submitting, triggers one
 * re-authentication and one resubmission. A second transport failure, or one during
 * re-authentication, fails every record still pending and the run moves on to the next chunk. An
 * {@link AuthException} fails the pending records and then aborts the run.</li>
 * </ol>
 *
 * <p>
 * Every record that ends in {@link RecordState#FAILED} is written to the request's error sink
 * exactly once. Chunks are processed strictly in order; cancellation is honored between
 * chunks.
 * </p>
 */
@Slf4j
public class BatchDispatcher {

    /**
     * Waits between retry attempts. Replaced in tests.
     */
    interface Sleeper {

        void sleep(Duration duration) throws InterruptedException;
    }

    private final RemoteObjectStore store;
    private final SessionProvider sessionProvider;
    private final RetryPolicy retryPolicy;
    private final RunCancellation cancellation;
    private final Sleeper sleeper;

    /**
     * Creates a dispatcher.
     *
     * @param store remote object store
     * @param sessionProvider session provider
     * @param retryPolicy retry policy for transient failures
     * @param cancellation cancellation flag checked between chunks
     */
    public BatchDispatcher(RemoteObjectStore store, SessionProvider sessionProvider,
            RetryPolicy retryPolicy, RunCancellation cancellation) {
        this(store, sessionProvider, retryPolicy, cancellation,
                duration -> Thread.sleep(duration.toMillis()));
    }

    BatchDispatcher(RemoteObjectStore store, SessionProvider sessionProvider,
            RetryPolicy retryPolicy, RunCancellation cancellation, Sleeper sleeper) {
        this.store = store;
        this.sessionProvider = sessionProvider;
        this.retryPolicy = retryPolicy;
        this.cancellation = cancellation;
        this.sleeper = sleeper;
    }

    /**
     * Dispatches all rows of a request.
     *
     * @param request dispatch request
     * @return run summary
     * @throws ConfigException if the batch size or the upsert external id is invalid; raised
     *         before any remote call
     * @throws io.github.yok.forcelink.exception.ErrorSinkException if a failed record cannot be
     *         written
     */
    public SyncSummary dispatch(DispatchRequest request) {
        Batch.validateSize(request.getBatchSize());
        if (request.getOperation() == Operation.UPSERT
                && StringUtils.isBlank(request.getExternalIdField())) {
            throw new ConfigException("External ID field is required for upsert.");
        }

        List<TrackedRecord> records = request.getRows().stream()
                .map(row -> new TrackedRecord(row, request.getFieldMapping().apply(row)))
                .collect(Collectors.toList());
        List<List<TrackedRecord>> chunks = Lists.partition(records, request.getBatchSize());
        log.info("Dispatching {} {} records to {} in {} chunk(s) of at most {}", records.size(),
                request.getOperation().getLabel(), request.getObjectName(), chunks.size(),
                request.getBatchSize());

        int started = 0;
        int skipped = 0;
        boolean cancelled = false;
        cancellation.begin();
        try {
            for (List<TrackedRecord> chunk : chunks) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    skipped = records.size() - started * request.getBatchSize();
                    log.warn("Run cancelled: {} record(s) in {} chunk(s) not started", skipped,
                            chunks.size() - started);
                    break;
                }
                started++;
                processChunk(request, chunk);
                log.info("Chunk {}/{} done: {} succeeded, {} failed", started, chunks.size(),
                        count(chunk, RecordState.SUCCEEDED), count(chunk, RecordState.FAILED));
            }
        } finally {
            cancellation.end();
        }

        return SyncSummary.builder().objectName(request.getObjectName())
                .operation(request.getOperation()).total(records.size())
                .succeeded(count(records, RecordState.SUCCEEDED))
                .failed(count(records, RecordState.FAILED)).skipped(skipped).chunks(started)
                .cancelled(cancelled).errorFile(request.getErrorSink().getFile().orElse(null))
                .build();
    }

    private void processChunk(DispatchRequest request, List<TrackedRecord> chunk) {
        Operation operation = request.getOperation();
        String requiredKey = operation.requiredKey(request.getExternalIdField());
        List<TrackedRecord> pending = new ArrayList<>();
        for (TrackedRecord record : chunk) {
            if (requiredKey != null && StringUtils.isBlank(record.payload.get(requiredKey))) {
                fail(request, record, "Missing required field '" + requiredKey + "' for "
                        + operation.getLabel());
            } else {
                pending.add(record);
            }
        }

        boolean reauthenticated = false;
        Session session = null;
        int attempt = 0;
        while (!pending.isEmpty()) {
            attempt++;
            List<RecordOutcome> outcomes;
            try {
                if (session == null) {
                    session = acquire(request, pending);
                }
                pending.forEach(record -> record.state = RecordState.IN_FLIGHT);
                Batch batch = Batch.of(operation, payloads(pending),
                        request.getExternalIdField(), request.getBatchSize());
                outcomes = store.submit(session, request.getObjectName(), batch);
            } catch (TransientApiException e) {
                outcomes = Collections.nCopies(pending.size(),
                        RecordOutcome.transientFailure(e.getMessage()));
            } catch (PermanentApiException e) {
                outcomes = Collections.nCopies(pending.size(),
                        RecordOutcome.permanentFailure(e.getMessage()));
            } catch (TransportException e) {
                if (!reauthenticated) {
                    reauthenticated = true;
                    attempt--;
                    log.warn("Transport failure ({}); re-authenticating and resubmitting {} "
                            + "record(s)", e.getMessage(), pending.size());
                    session = reauthenticate(request, pending);
                    if (session == null) {
                        return;
                    }
                    continue;
                }
                outcomes = Collections.nCopies(pending.size(),
                        RecordOutcome.permanentFailure("Transport failure: " + e.getMessage()));
            }
            if (outcomes.size() != pending.size()) {
                outcomes = Collections.nCopies(pending.size(),
                        RecordOutcome.permanentFailure("Remote store returned " + outcomes.size()
                                + " outcomes for " + pending.size() + " records"));
            }
            pending = absorb(request, pending, outcomes, attempt);
            if (!pending.isEmpty() && !backoff(request, pending, attempt)) {
                return;
            }
        }
    }

    // Returns the records to retry
    private List<TrackedRecord> absorb(DispatchRequest request, List<TrackedRecord> submitted,
            List<RecordOutcome> outcomes, int attempt) {
        List<TrackedRecord> retry = new ArrayList<>();
        for (int i = 0; i < submitted.size(); i++) {
            TrackedRecord record = submitted.get(i);
            RecordOutcome outcome = outcomes.get(i);
            if (outcome.getStatus() == OutcomeStatus.SUCCEEDED) {
                record.state = RecordState.SUCCEEDED;
                request.getSuccessSink().record(record.row, outcome.getRecordId());
            } else if (outcome.getStatus() == OutcomeStatus.TRANSIENT_FAILURE
                    && attempt < retryPolicy.getMaxAttempts()) {
                record.state = RecordState.RETRYING;
                retry.add(record);
            } else if (outcome.getStatus() == OutcomeStatus.TRANSIENT_FAILURE) {
                fail(request, record,
                        outcome.getReason() + " (gave up after " + attempt + " attempts)");
            } else {
                fail(request, record, outcome.getReason());
            }
        }
        return retry;
    }

    private boolean backoff(DispatchRequest request, List<TrackedRecord> retry, int attempt) {
        Duration wait = retryPolicy.backoffAfter(attempt);
        log.info("Retrying {} record(s) in {} ms (attempt {}/{})", retry.size(), wait.toMillis(),
                attempt + 1, retryPolicy.getMaxAttempts());
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException e) {
            cancellation.cancel();
            // File channels close on interrupt; record the failures before restoring the flag
            retry.forEach(record -> fail(request, record, "Interrupted before retry"));
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Session acquire(DispatchRequest request, List<TrackedRecord> pending) {
        try {
            return sessionProvider.acquire();
        } catch (AuthException e) {
            pending.forEach(record -> fail(request, record,
                    "Authentication failed: " + e.getMessage()));
            throw e;
        }
    }

    // Returns null when the chunk has been failed and must not be resubmitted
    private Session reauthenticate(DispatchRequest request, List<TrackedRecord> pending) {
        try {
            return sessionProvider.reauthenticate();
        } catch (TransportException e) {
            log.warn("Re-authentication failed ({}); {} record(s) of this chunk failed",
                    e.getMessage(), pending.size());
            pending.forEach(record -> fail(request, record,
                    "Transport failure: " + e.getMessage()));
            return null;
        } catch (AuthException e) {
            pending.forEach(record -> fail(request, record,
                    "Re-authentication failed: " + e.getMessage()));
            throw e;
        }
    }

    private void fail(DispatchRequest request, TrackedRecord record, String reason) {
        record.state = RecordState.FAILED;
        log.debug("Row {} failed: {}", record.row.getRowNumber(), reason);
        request.getErrorSink().record(record.row, reason, request.getOperation());
    }

    private static List<Map<String, String>> payloads(List<TrackedRecord> records) {
        return records.stream().map(record -> record.payload).collect(Collectors.toList());
    }

    private static int count(List<TrackedRecord> records, RecordState state) {
        return (int) records.stream().filter(record -> record.state == state).count();
    }

    // A row and its mapped payload as it moves through one run
    private static final class TrackedRecord {

        private final SourceRow row;
        private final Map<String, String> payload;
        private RecordState state = RecordState.PENDING;

        private TrackedRecord(SourceRow row, Map<String, String> payload) {
            this.row = row;
            this.payload = payload;
        }
    }
}
