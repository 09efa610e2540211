package io.settingstree.core.error;

/** Thrown when two sources contribute the same property name to one merged entity. */
public final class MergeException extends SettingsTreeException {

    private static final long serialVersionUID = 1L;

    public MergeException(String message, String path) {
        super(message, path, Phase.MERGE);
    }

    /** Path of the entity where the collision happened. */
    public String path() {
        return subject();
    }
}
