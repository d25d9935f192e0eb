package io.github.yok.forcelink.store;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Set;

/**
 * Decides whether a remote failure is worth retrying.
 */
public final class ErrorClassifier {

    /**
     * Per-record status codes that describe a temporary condition.
     */
    public static final Set<String> TRANSIENT_STATUS_CODES = ImmutableSet.of(
            "REQUEST_LIMIT_EXCEEDED", "UNABLE_TO_LOCK_ROW", "SERVER_UNAVAILABLE",
            "API_TEMPORARILY_UNAVAILABLE");

    private ErrorClassifier() {}

    /**
     * Returns whether any of the record's error codes is transient.
     *
     * @param statusCodes error codes reported for one record
     * @return {@code true} if the record may be retried
     */
    public static boolean isTransient(Collection<String> statusCodes) {
        return statusCodes.stream().anyMatch(TRANSIENT_STATUS_CODES::contains);
    }

    /**
     * Returns whether an HTTP status of a whole call is transient (429 or 5xx).
     *
     * @param httpStatus HTTP status code
     * @return {@code true} if the call may be retried
     */
    public static boolean isTransientStatus(int httpStatus) {
        return httpStatus == 429 || httpStatus >= 500;
    }
}
