package io.github.yok.forcelink.exception;

/**
 * Failed rows could not be persisted to the error file. Fatal for the run.
 */
public class ErrorSinkException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public ErrorSinkException(String message) {
        super(message);
    }

    public ErrorSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
