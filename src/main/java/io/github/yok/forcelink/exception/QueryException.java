package io.github.yok.forcelink.exception;

/**
 * The remote store rejected a query or failed while paging its results.
 */
public class QueryException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
