package io.settingstree.core.config;

/**
 * Thrown when an options file cannot be loaded: missing file, invalid YAML, or a value of the wrong
 * shape.
 */
public class OptionsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OptionsLoadException(String message) {
        super(message);
    }

    public OptionsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
