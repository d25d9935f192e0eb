package io.github.yok.forcelink.model;

/**
 * Classification of one record's result as reported by a single remote call.
 */
public enum OutcomeStatus {
    // Accepted by the remote store
    SUCCEEDED,
    // Timeout, rate limit or temporary unavailability; worth another attempt
    TRANSIENT_FAILURE,
    // Validation, permission or duplicate-value failure; never retried
    PERMANENT_FAILURE
}
