package io.github.yok.forcelink.model;

import java.time.OffsetDateTime;
import lombok.NonNull;
import lombok.Value;

/**
 * A row whose outcome reached the terminal failed state, as persisted to the error file.
 */
@Value
public class ErrorRecord {

    // Original, pre-mapping row content
    @NonNull
    SourceRow row;

    @NonNull
    String errorReason;

    @NonNull
    OffsetDateTime failedAt;

    @NonNull
    Operation sourceOperation;
}
