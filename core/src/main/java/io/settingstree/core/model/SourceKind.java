package io.settingstree.core.model;

/** The two kinds of input a settings tree is built from. */
public enum SourceKind {
    /** Hardware description tree. */
    HARDWARE("compatible", "status"),
    /** Software configuration tree. */
    CONFIG("schema", "enabled");

    private final String schemaProperty;
    private final String enabledProperty;

    SourceKind(String schemaProperty, String enabledProperty) {
        this.schemaProperty = schemaProperty;
        this.enabledProperty = enabledProperty;
    }

    /** Raw property listing the schema ids of a node, also the binding key declaring a schema id. */
    public String schemaProperty() {
        return schemaProperty;
    }

    /** Raw property carrying the enabled state of a node. */
    public String enabledProperty() {
        return enabledProperty;
    }
}
