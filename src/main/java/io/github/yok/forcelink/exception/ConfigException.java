package io.github.yok.forcelink.exception;

/**
 * Invalid option combination or configuration value. Always raised before any network call.
 */
public class ConfigException extends ForceLinkException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
