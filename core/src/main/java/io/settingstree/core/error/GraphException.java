package io.settingstree.core.error;

/** Thrown when the dependency graph has no roots or contains a dependency loop. */
public final class GraphException extends SettingsTreeException {

    private static final long serialVersionUID = 1L;

    public GraphException(String message) {
        super(message, null, Phase.ORDERING);
    }

    public GraphException(String message, String path) {
        super(message, path, Phase.ORDERING);
    }
}
