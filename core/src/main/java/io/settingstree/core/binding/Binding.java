package io.settingstree.core.binding;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.settingstree.core.model.SourceKind;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved binding: includes merged and filtered, the result validated.
 *
 * <p>
 * Instances are created by {@link BindingParser} and are immutable.
 */
public final class Binding {

    private final SourceKind kind;
    private final String origin;
    private final String schema;
    private final String description;
    private final String variant;
    private final List<String> buses;
    private final Map<String, List<String>> specifierCells;
    private final Map<String, PropertySpec> propertySpecs;
    private final Map<String, ChildBinding> childBindings;
    private final ObjectNode document;
    private final boolean child;

    Binding(
            SourceKind kind,
            String origin,
            String schema,
            String description,
            String variant,
            List<String> buses,
            Map<String, List<String>> specifierCells,
            Map<String, PropertySpec> propertySpecs,
            Map<String, ChildBinding> childBindings,
            ObjectNode document,
            boolean child) {
        this.kind = kind;
        this.origin = origin;
        this.schema = schema;
        this.description = description;
        this.variant = variant;
        this.buses = List.copyOf(buses);
        this.specifierCells = Collections.unmodifiableMap(new LinkedHashMap<>(specifierCells));
        this.propertySpecs = Collections.unmodifiableMap(new LinkedHashMap<>(propertySpecs));
        this.childBindings = Collections.unmodifiableMap(new LinkedHashMap<>(childBindings));
        this.document = document;
        this.child = child;
    }

    public SourceKind kind() {
        return kind;
    }

    /** The file this binding was read from, or a synthetic origin such as {@code <built-in>}. */
    public String origin() {
        return origin;
    }

    /** The schema id this binding validates, or null for anonymous child bindings. */
    public String schema() {
        return schema;
    }

    public String description() {
        return description;
    }

    /** Bus this binding applies on ({@code on-bus:}), or null. */
    public String variant() {
        return variant;
    }

    /** Bus protocols provided by nodes with this binding ({@code bus:}). */
    public List<String> buses() {
        return buses;
    }

    /**
     * Cell names for a specifier space, e.g. {@code [pin, flags]} for {@code gpio}.
     *
     * @return the names, or an empty list when the binding declares none
     */
    public List<String> specifierCells(String space) {
        return specifierCells.getOrDefault(space, List.of());
    }

    public Map<String, List<String>> specifierCells() {
        return specifierCells;
    }

    /** Property declarations keyed by name pattern, in document order. */
    public Map<String, PropertySpec> propertySpecs() {
        return propertySpecs;
    }

    /** Child bindings keyed by child name pattern, in document order. */
    public Map<String, ChildBinding> childBindings() {
        return childBindings;
    }

    /** Whether this binding came from a property with {@code type: node}. */
    public boolean isChild() {
        return child;
    }

    /** A copy of the merged and filtered document this binding was built from. */
    public ObjectNode document() {
        return document.deepCopy();
    }

    /** File name of the origin, for log messages. */
    public String originName() {
        Path fileName = origin.startsWith("<") ? null : Path.of(origin).getFileName();
        return fileName == null ? origin : fileName.toString();
    }

    @Override
    public String toString() {
        return "Binding{" + originName()
                + (schema != null ? ", schema=" + schema : "")
                + (variant != null ? ", on-bus=" + variant : "")
                + "}";
    }
}
