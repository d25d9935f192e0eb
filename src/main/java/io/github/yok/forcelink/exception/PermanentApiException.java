package io.github.yok.forcelink.exception;

/**
 * Non-retryable remote failure (validation, permission, duplicate value).
 */
public class PermanentApiException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public PermanentApiException(String message) {
        super(message);
    }

    public PermanentApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
