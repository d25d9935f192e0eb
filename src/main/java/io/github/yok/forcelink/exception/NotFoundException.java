package io.github.yok.forcelink.exception;

/**
 * The requested record does not exist in the remote store.
 */
public class NotFoundException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
