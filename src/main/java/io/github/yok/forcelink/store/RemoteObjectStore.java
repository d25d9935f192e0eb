package io.github.yok.forcelink.store;

import io.github.yok.forcelink.model.Batch;
import io.github.yok.forcelink.model.QueryPage;
import io.github.yok.forcelink.model.RecordOutcome;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Remote CRM object store.
 *
 * <p>
 * Every bulk call returns exactly one {@link RecordOutcome} per submitted record, in submission
 * order. A failure of the call as a whole is reported by exception:
 * </p>
 * <ul>
 * <li>{@link io.github.yok.forcelink.exception.TransientApiException}: rate limit, server error or
 * timeout; every record of the call may be retried.</li>
 * <li>{@link io.github.yok.forcelink.exception.PermanentApiException}: the request was rejected;
 * every record of the call has failed.</li>
 * <li>{@link io.github.yok.forcelink.exception.TransportException}: no usable response, or the
 * session was rejected.</li>
 * </ul>
 */
public interface RemoteObjectStore {

    List<RecordOutcome> insert(Session session, String objectName,
            List<Map<String, String>> records);

    List<RecordOutcome> update(Session session, String objectName,
            List<Map<String, String>> records);

    List<RecordOutcome> upsert(Session session, String objectName, String externalIdField,
            List<Map<String, String>> records);

    List<RecordOutcome> delete(Session session, List<String> ids);

    /**
     * Runs a query and returns its first page.
     *
     * @param session session
     * @param soql query text
     * @return first page
     * @throws io.github.yok.forcelink.exception.QueryException if the store rejects the query
     */
    QueryPage query(Session session, String soql);

    /**
     * Fetches the page following a previous one.
     *
     * @param session session
     * @param nextToken token of the previous page
     * @return next page
     */
    QueryPage queryMore(Session session, String nextToken);

    /**
     * Lists the field names of an object.
     *
     * @param session session
     * @param objectName object name
     * @return field names in declaration order
     */
    Set<String> describeFields(Session session, String objectName);

    /**
     * Submits a batch using the call that matches its operation.
     *
     * @param session session
     * @param objectName object name
     * @param batch batch to submit
     * @return one outcome per record, in order
     */
    default List<RecordOutcome> submit(Session session, String objectName, Batch batch) {
        switch (batch.getOperation()) {
            case INSERT:
                return insert(session, objectName, batch.getRecords());
            case UPDATE:
                return update(session, objectName, batch.getRecords());
            case UPSERT:
                return upsert(session, objectName, batch.getExternalIdField(),
                        batch.getRecords());
            case DELETE:
                return delete(session, batch.getRecords().stream().map(record -> record.get("Id"))
                        .collect(Collectors.toList()));
            default:
                throw new IllegalArgumentException(
                        "Unsupported operation: " + batch.getOperation());
        }
    }
}
