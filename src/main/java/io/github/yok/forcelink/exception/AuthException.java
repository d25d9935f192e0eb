package io.github.yok.forcelink.exception;

/**
 * A valid session could not be obtained or refreshed. Fatal for the run.
 */
public class AuthException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
