package io.settingstree.core.error;

/**
 * Abstract base for all settings-tree exceptions. Never thrown directly, use one of the concrete
 * subclasses. Every failure is fatal: nothing is recovered from inside the library.
 */
public abstract class SettingsTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        SOURCE,
        BINDING,
        RESOLUTION,
        MERGE,
        ORDERING,
        LIFECYCLE
    }

    private final String subject;
    private final Phase phase;

    protected SettingsTreeException(String message, String subject, Phase phase) {
        super(message);
        this.subject = subject;
        this.phase = phase;
    }

    protected SettingsTreeException(String message, Throwable cause, String subject, Phase phase) {
        super(message, cause);
        this.subject = subject;
        this.phase = phase;
    }

    /** The binding file or node path that triggered the error, or {@code null} if not known. */
    public String subject() {
        return subject;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
