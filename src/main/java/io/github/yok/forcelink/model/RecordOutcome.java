package io.github.yok.forcelink.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one record within one remote bulk call.
 *
 * <p>
 * The remote store returns exactly one outcome per submitted record, in submission order.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecordOutcome {

    OutcomeStatus status;

    // Id assigned or matched by the remote store (successes only)
    String recordId;

    // Remote error message (failures only)
    String reason;

    public static RecordOutcome succeeded(String recordId) {
        return new RecordOutcome(OutcomeStatus.SUCCEEDED, recordId, null);
    }

    public static RecordOutcome transientFailure(String reason) {
        return new RecordOutcome(OutcomeStatus.TRANSIENT_FAILURE, null, reason);
    }

    public static RecordOutcome permanentFailure(String reason) {
        return new RecordOutcome(OutcomeStatus.PERMANENT_FAILURE, null, reason);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCEEDED;
    }
}
