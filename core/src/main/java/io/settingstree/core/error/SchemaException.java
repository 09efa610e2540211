package io.settingstree.core.error;

/**
 * Thrown when a binding document is malformed: bad include directives, illegal overrides, unknown
 * keys, wrong types, or a duplicate {@code (schema, variant)} registration.
 */
public final class SchemaException extends SettingsTreeException {

    private static final long serialVersionUID = 1L;

    public SchemaException(String message, String source) {
        super(message, source, Phase.BINDING);
    }

    public SchemaException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.BINDING);
    }

    /** The binding file (or in-memory origin) that caused the error. */
    public String source() {
        return subject();
    }
}
