package io.github.yok.forcelink.exception;

/**
 * Field mapping could not be built (duplicate or unknown target field). Fatal before dispatch.
 */
public class MappingException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
