package io.github.yok.forcelink.model;

/**
 * Life cycle of a record inside one dispatch run.
 *
 * <pre>
 * PENDING -&gt; IN_FLIGHT -&gt; SUCCEEDED
 *                      -&gt; RETRYING -&gt; IN_FLIGHT
 *                      -&gt; FAILED
 * </pre>
 */
public enum RecordState {
    PENDING, IN_FLIGHT, RETRYING, SUCCEEDED, FAILED;

    /**
     * Returns whether no further transition is possible.
     *
     * @return {@code true} for {@link #SUCCEEDED} and {@link #FAILED}
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
