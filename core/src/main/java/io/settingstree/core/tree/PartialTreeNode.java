package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.binding.Binding;
import io.settingstree.core.binding.ChildBinding;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.binding.PropertyType;
import io.settingstree.core.config.DiagnosticKind;
import io.settingstree.core.error.PropertyException;
import io.settingstree.core.model.RawNode;
import io.settingstree.core.model.SourceKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node of a {@link PartialTree}: one raw node with its bindings matched and its properties
 * resolved to typed values.
 *
 * <p>
 * Instances are created and filled in by the owning tree while it processes; they are read-only
 * once the tree is {@link PartialTree.State#CHECKED checked}.
 */
public final class PartialTreeNode implements Node {

    private final PartialTree tree;
    private final RawNode raw;

    private List<String> schemas = List.of();
    private boolean enabled;
    private final List<Binding> bindings = new ArrayList<>();
    private final List<String> matchingSchemas = new ArrayList<>();
    private final Map<String, PropertySpec> specs = new LinkedHashMap<>();
    private final Map<String, List<String>> specifierCells = new LinkedHashMap<>();
    private Map<String, PartialTreeProperty> properties = Map.of();

    // hardware only
    private PartialTreeNode busNode;
    private List<String> buses = List.of();
    private List<Register> registers = List.of();
    private List<AddressRange> ranges = List.of();
    private List<ControllerAndData> interrupts = List.of();

    PartialTreeNode(PartialTree tree, RawNode raw) {
        this.tree = tree;
        this.raw = raw;
    }

    // --- Node ---

    @Override
    public String path() {
        return raw.path();
    }

    @Override
    public String name() {
        return raw.isRoot() ? "/" : raw.name();
    }

    @Override
    public PartialTreeNode parent() {
        return raw.parentPath() == null ? null : tree.lookup(raw.parentPath());
    }

    @Override
    public List<PartialTreeNode> children() {
        List<PartialTreeNode> children = new ArrayList<>();
        for (String childName : raw.childNames()) {
            PartialTreeNode child = tree.lookup(raw.childPath(childName));
            if (child != null) {
                children.add(child);
            }
        }
        return children;
    }

    @Override
    public List<String> labels() {
        return raw.labels();
    }

    @Override
    public List<String> schemas() {
        return schemas;
    }

    @Override
    public List<Binding> bindings() {
        return Collections.unmodifiableList(bindings);
    }

    @Override
    public List<String> matchingSchemas() {
        return Collections.unmodifiableList(matchingSchemas);
    }

    @Override
    public Map<String, PartialTreeProperty> properties() {
        return properties;
    }

    @Override
    public PartialTreeProperty property(String name) {
        return properties.get(name);
    }

    @Override
    public boolean enabled() {
        return enabled;
    }

    public SourceKind kind() {
        return tree.kind();
    }

    /** Name of the source this node was read from. */
    public String source() {
        return tree.source();
    }

    public PartialTree tree() {
        return tree;
    }

    /** Cell names of {@code space} declared by the node's bindings, first declaration wins. */
    public List<String> specifierCells(String space) {
        return specifierCells.getOrDefault(space, List.of());
    }

    /** The unit address after {@code @} in the node name, or null. */
    public Long unitAddress() {
        int at = raw.name().indexOf('@');
        if (at < 0) {
            return null;
        }
        try {
            return Long.parseUnsignedLong(raw.name().substring(at + 1), 16);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Nodes this node depends on beyond its properties. */
    public List<Node> sourceDependencies() {
        return tree.driver().sourceDependencies(this);
    }

    // --- hardware ---

    /** Normalized hardware status: {@code okay} when absent or {@code ok}. */
    public String status() {
        return HardwareDriver.status(raw);
    }

    /** Buses this node provides, from its bindings' {@code bus:}. */
    public List<String> buses() {
        return buses;
    }

    /** Buses of the bus node this node sits on, or empty. */
    public List<String> onBuses() {
        return busNode == null ? List.of() : busNode.buses();
    }

    /** The closest ancestor providing a bus, or null. */
    public PartialTreeNode busNode() {
        return busNode;
    }

    public List<Register> registers() {
        return registers;
    }

    public List<AddressRange> ranges() {
        return ranges;
    }

    public List<ControllerAndData> interrupts() {
        return interrupts;
    }

    void setBusNode(PartialTreeNode busNode) {
        this.busNode = busNode;
    }

    void setBuses(List<String> buses) {
        this.buses = List.copyOf(buses);
    }

    void setRegisters(List<Register> registers) {
        this.registers = registers;
    }

    void setRanges(List<AddressRange> ranges) {
        this.ranges = ranges;
    }

    void setInterrupts(List<ControllerAndData> interrupts) {
        this.interrupts = Collections.unmodifiableList(new ArrayList<>(interrupts));
    }

    // --- raw access ---

    RawNode raw() {
        return raw;
    }

    /**
     * A raw single-cell integer property such as {@code #address-cells}.
     *
     * @return the value, or null when the property is absent
     * @throws PropertyException if the property is not exactly one cell
     */
    Long rawInt(String name) {
        JsonNode value = raw.property(name);
        if (value == null) {
            return null;
        }
        long[] cells = Cells.numbers(Cells.flatten(value));
        if (cells == null || cells.length != 1) {
            throw new PropertyException(
                    "expected property '" + name + "' on " + path() + " in " + source()
                            + " to be assigned with '" + name + " = < (number) >;', not '" + value + "'",
                    path(),
                    name);
        }
        return cells[0];
    }

    // --- phase 1: bindings ---

    void matchBindings() {
        SourceDriver driver = tree.driver();
        schemas = List.copyOf(driver.schemas(raw));
        enabled = driver.enabled(raw);
        driver.beforeBindings(this);

        Binding inferred = driver.inferredBinding(this);
        if (inferred != null) {
            bindings.add(inferred);
        }
        for (String schema : schemas) {
            Binding binding = driver.bindingFor(this, schema);
            if (binding != null) {
                bindings.add(binding);
                matchingSchemas.add(schema);
            }
        }
        PartialTreeNode parent = parent();
        if (parent != null) {
            for (Binding parentBinding : parent.bindings) {
                for (ChildBinding childBinding : parentBinding.childBindings().values()) {
                    if (childBinding.matches(name())) {
                        bindings.addAll(childBinding.bindings());
                    }
                }
            }
        }

        // earlier bindings take precedence
        for (int i = bindings.size() - 1; i >= 0; i--) {
            specs.putAll(bindings.get(i).propertySpecs());
            specifierCells.putAll(bindings.get(i).specifierCells());
        }
        if (bindings.isEmpty() && tree.options().defaultPropertyTypes()) {
            specs.putAll(driver.defaultSpecs());
        } else if (!bindings.isEmpty()) {
            checkUndeclared(driver);
        }
        driver.afterBindings(this);
    }

    private void checkUndeclared(SourceDriver driver) {
        for (String name : raw.properties().keySet()) {
            if (name.equals(kind().schemaProperty())
                    || name.equals(kind().enabledProperty())
                    || "phandle".equals(name)
                    || driver.isImplicitlyDeclared(name)) {
                continue;
            }
            if (specs.values().stream().noneMatch(spec -> spec.matches(name))) {
                throw new PropertyException(
                        "'" + name + "' appears in " + path() + " in " + source() + ", but is not declared in"
                                + " 'properties:' in " + String.join(", ", bindingOrigins()),
                        path(),
                        name);
            }
        }
    }

    // --- phase 2: properties ---

    void resolveProperties(ReferenceScope scope) {
        Set<String> claimed = new HashSet<>();
        for (PropertySpec spec : specs.values()) {
            if (raw.properties().containsKey(spec.name())) {
                claimed.add(spec.name());
            }
        }

        Map<String, PartialTreeProperty> resolved = new LinkedHashMap<>();
        for (PropertySpec spec : specs.values()) {
            JsonNode value = raw.property(spec.name());
            if (value != null) {
                resolve(spec, value, scope, resolved);
            } else if (spec.isLiteral()) {
                resolveAbsent(spec, resolved);
            } else {
                for (Map.Entry<String, JsonNode> entry : raw.properties().entrySet()) {
                    if (!claimed.contains(entry.getKey()) && spec.matches(entry.getKey())) {
                        claimed.add(entry.getKey());
                        resolve(spec.named(entry.getKey()), entry.getValue(), scope, resolved);
                    }
                }
            }
        }
        properties = Collections.unmodifiableMap(resolved);
        tree.driver().resolveCrossReferences(this);
    }

    private void resolve(
            PropertySpec spec, JsonNode value, ReferenceScope scope, Map<String, PartialTreeProperty> resolved) {
        if (spec.deprecated()) {
            String message = "'" + spec.name() + "' is marked as deprecated in 'properties:' in " + spec.origin()
                    + " for node " + path() + ".";
            tree.diagnostics().report(DiagnosticKind.DEPRECATED_PROPERTY, message,
                    () -> new PropertyException(message, path(), spec.name()));
        }
        Object typed = ValueConverter.convert(this, spec, value, scope);
        if (typed == null) {
            return;
        }
        checkEnum(spec, typed);
        checkConst(spec, typed);
        expose(spec, typed, resolved);
    }

    private void resolveAbsent(PropertySpec spec, Map<String, PartialTreeProperty> resolved) {
        if (spec.required() && enabled) {
            throw new PropertyException(
                    "'" + spec.name() + "' is marked as required in 'properties:' in " + spec.origin()
                            + ", but does not appear in " + path() + " in " + source() + ".",
                    path(),
                    spec.name());
        }
        if (spec.defaultValue() != null) {
            expose(spec, ValueConverter.fromBindingValue(spec, spec.defaultValue()), resolved);
        } else if (spec.type() == PropertyType.BOOLEAN) {
            expose(spec, Boolean.FALSE, resolved);
        }
    }

    private void checkEnum(PropertySpec spec, Object value) {
        if (!spec.hasEnum()) {
            return;
        }
        for (Object element : Values.elements(value)) {
            if (Values.indexIn(element, spec.enumValues()) < 0) {
                throw new PropertyException(
                        "value of property '" + spec.name() + "' on " + path() + " in " + source() + " ("
                                + Values.display(element) + ") is not in 'enum' list in " + spec.origin() + " ("
                                + spec.enumValues() + ")",
                        path(),
                        spec.name());
            }
        }
    }

    private void checkConst(PropertySpec spec, Object value) {
        if (spec.constValue() != null && !Values.constEquals(value, spec.constValue())) {
            throw new PropertyException(
                    "value of property '" + spec.name() + "' on " + path() + " in " + source() + " ("
                            + Values.display(value) + ") is different from the 'const' value specified in "
                            + spec.origin() + " (" + spec.constValue() + ")",
                    path(),
                    spec.name());
        }
    }

    private void expose(PropertySpec spec, Object value, Map<String, PartialTreeProperty> resolved) {
        if (spec.name().startsWith("#") || spec.name().endsWith("-map")) {
            return;
        }
        resolved.put(spec.name(), new PartialTreeProperty(spec, this, value));
    }

    // --- phase 3: checks ---

    void check() {
        tree.driver().check(this);
    }

    @Override
    public String toString() {
        return "PartialTreeNode{" + path() + ", source=" + source() + ", bindings=" + bindingOrigins() + "}";
    }
}
