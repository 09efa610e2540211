package io.settingstree.core.error;

/**
 * Thrown when a raw property value cannot be resolved against its property spec: missing required
 * value, wrong shape, enum or const violation, dangling reference, or an unmappable specifier.
 */
public final class PropertyException extends SettingsTreeException {

    private static final long serialVersionUID = 1L;

    private final String propertyName;

    public PropertyException(String message, String nodePath, String propertyName) {
        super(message, nodePath, Phase.RESOLUTION);
        this.propertyName = propertyName;
    }

    public PropertyException(String message, Throwable cause, String nodePath, String propertyName) {
        super(message, cause, nodePath, Phase.RESOLUTION);
        this.propertyName = propertyName;
    }

    /** Path of the node owning the property. */
    public String nodePath() {
        return subject();
    }

    /** The offending property, or {@code null} when the error concerns the node as a whole. */
    public String propertyName() {
        return propertyName;
    }
}
