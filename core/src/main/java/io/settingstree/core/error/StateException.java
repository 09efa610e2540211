package io.settingstree.core.error;

/**
 * Thrown when a tree is used out of lifecycle order, for example querying nodes before processing
 * or adding a source after the merge started.
 */
public final class StateException extends SettingsTreeException {

    private static final long serialVersionUID = 1L;

    public StateException(String message, String subject) {
        super(message, subject, Phase.LIFECYCLE);
    }
}
