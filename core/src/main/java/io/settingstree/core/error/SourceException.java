package io.settingstree.core.error;

/**
 * Thrown when a source document cannot be read into a raw tree: unreadable file, malformed YAML, or
 * a configuration overlay whose mount point cannot be found.
 */
public final class SourceException extends SettingsTreeException {

    private static final long serialVersionUID = 1L;

    public SourceException(String message, String source) {
        super(message, source, Phase.SOURCE);
    }

    public SourceException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.SOURCE);
    }

    /** The source document that caused the error. */
    public String source() {
        return subject();
    }
}
