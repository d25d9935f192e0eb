package io.github.yok.forcelink.exception;

/**
 * The external scraper failed or returned no usable (or an ambiguous) match.
 */
public class ScrapeException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
