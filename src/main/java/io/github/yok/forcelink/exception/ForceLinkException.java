package io.github.yok.forcelink.exception;

/**
 * Base class of every failure raised by ForceLink.
 *
 * <p>
 * Subclasses are split into two groups:
 * </p>
 * <ul>
 * <li>global failures that abort a run ({@link ConfigException}, {@link AuthException},
 * {@link MappingException}, {@link ErrorSinkException});</li>
 * <li>scoped failures that are isolated to one record, one chunk or one enrichment invocation
 * ({@link TransientApiException}, {@link PermanentApiException}, {@link TransportException},
 * {@link QueryException}, {@link ScrapeException}, {@link NotFoundException}).</li>
 * </ul>
 */
public class ForceLinkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public ForceLinkException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public ForceLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
