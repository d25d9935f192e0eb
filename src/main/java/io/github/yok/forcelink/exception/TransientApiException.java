package io.github.yok.forcelink.exception;

/**
 * Retryable remote failure (timeout, rate limit, temporary unavailability).
 */
public class TransientApiException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public TransientApiException(String message) {
        super(message);
    }

    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
