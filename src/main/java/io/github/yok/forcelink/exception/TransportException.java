package io.github.yok.forcelink.exception;

/**
 * Chunk-level transport failure such as an expired session or a broken connection.
 *
 * <p>
 * Unlike {@link TransientApiException}, this failure is not attributed to individual records: the
 * whole request did not reach (or did not come back from) the remote store.
 * </p>
 */
public class TransportException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    // true when the remote store reported the session as invalid or expired
    private final boolean sessionExpired;

    public TransportException(String message, boolean sessionExpired) {
        super(message);
        this.sessionExpired = sessionExpired;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.sessionExpired = false;
    }

    /**
     * Returns whether the failure was caused by an invalid session.
     *
     * @return {@code true} if the session was rejected
     */
    public boolean isSessionExpired() {
        return sessionExpired;
    }
}
