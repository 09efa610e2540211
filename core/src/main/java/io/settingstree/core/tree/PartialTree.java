package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.binding.Binding;
import io.settingstree.core.binding.BindingRegistry;
import io.settingstree.core.binding.BindingScanner;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.binding.PropertyType;
import io.settingstree.core.config.DiagnosticKind;
import io.settingstree.core.config.Diagnostics;
import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.PropertyException;
import io.settingstree.core.error.SchemaException;
import io.settingstree.core.error.StateException;
import io.settingstree.core.model.RawNode;
import io.settingstree.core.model.RawTree;
import io.settingstree.core.model.SourceKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The typed view of one source: every raw node with its bindings matched and its properties
 * resolved.
 *
 * <p>
 * A tree is processed exactly once. Until {@link #process(ReferenceScope)} has completed, every
 * query throws {@link StateException}.
 *
 * <pre>{@code
 * PartialTree tree = new PartialTree(SourceKind.CONFIG, raw, registry, options);
 * tree.process();
 * long timeout = tree.node("/app/http").property("timeout").asLong();
 * }</pre>
 */
public final class PartialTree {

    private static final Logger LOG = LoggerFactory.getLogger(PartialTree.class);

    /** Processing states, in order. */
    public enum State {
        UNPROCESSED,
        NODES_BUILT,
        CROSS_REFS_RESOLVED,
        CHECKED
    }

    private final SourceKind kind;
    private final RawTree raw;
    private final BindingRegistry registry;
    private final TreeOptions options;
    private final Diagnostics diagnostics;
    private final SourceDriver driver;
    private final SpecifierResolver specifiers;

    private final Map<String, PartialTreeNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<PartialTreeNode>> labelIndex = new LinkedHashMap<>();
    private State state = State.UNPROCESSED;

    public PartialTree(SourceKind kind, RawTree raw, BindingRegistry registry, TreeOptions options) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.raw = Objects.requireNonNull(raw, "raw must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.diagnostics = options.diagnostics();
        this.driver = kind == SourceKind.HARDWARE ? new HardwareDriver(this) : new ConfigDriver(this);
        this.specifiers = new SpecifierResolver(this);
    }

    /**
     * Builds a tree whose bindings are discovered in {@link TreeOptions#bindingDirs()}, keeping only
     * bindings for schemas the source uses.
     *
     * @throws SchemaException if a binding cannot be read or is invalid
     */
    public static PartialTree fromBindingDirs(SourceKind kind, RawTree raw, TreeOptions options) {
        BindingRegistry registry = BindingScanner.scan(kind, options.bindingDirs(), usedSchemas(kind, raw), options);
        return new PartialTree(kind, raw, registry, options);
    }

    /** Every schema id listed on a node of {@code raw}. */
    public static Set<String> usedSchemas(SourceKind kind, RawTree raw) {
        SourceDriver driver = new PartialTree(kind, raw, BindingRegistry.empty(), TreeOptions.defaults()).driver;
        Set<String> schemas = new LinkedHashSet<>();
        for (RawNode node : raw.nodes()) {
            schemas.addAll(driver.schemas(node));
        }
        return schemas;
    }

    // --- processing ---

    /** Processes the tree on its own; references must resolve within this source. */
    public void process() {
        process(ReferenceScope.EMPTY);
    }

    /**
     * Matches bindings, resolves every property and runs the final checks.
     *
     * @param scope nodes of previously processed sources that references may point to
     * @throws StateException if the tree was already processed
     * @throws io.settingstree.core.error.SettingsTreeException on the first invalid binding or value
     */
    public void process(ReferenceScope scope) {
        Objects.requireNonNull(scope, "scope must not be null");
        if (state != State.UNPROCESSED) {
            throw new StateException("Partial tree already processed: state=" + state, raw.source());
        }

        List<RawNode> ordered = new ArrayList<>(raw.nodes());
        ordered.sort(Comparator.comparingInt(PartialTree::depth));
        for (RawNode rawNode : ordered) {
            PartialTreeNode node = new PartialTreeNode(this, rawNode);
            nodes.put(rawNode.path(), node);
            for (String label : rawNode.labels()) {
                labelIndex.computeIfAbsent(label, k -> new ArrayList<>()).add(node);
            }
            node.matchBindings();
        }
        state = State.NODES_BUILT;

        for (PartialTreeNode node : nodes.values()) {
            node.resolveProperties(scope);
        }
        state = State.CROSS_REFS_RESOLVED;

        for (PartialTreeNode node : nodes.values()) {
            node.check();
        }
        checkEnumTokens();
        state = State.CHECKED;
        LOG.info("Partial tree processed: source={}, kind={}, nodes={}, bindings={}",
                raw.source(), kind, nodes.size(), registry.size());
    }

    private static int depth(RawNode node) {
        if (node.isRoot()) {
            return 0;
        }
        return (int) node.path().chars().filter(c -> c == '/').count();
    }

    private void checkEnumTokens() {
        for (Binding binding : registry.bindings()) {
            for (PropertySpec spec : binding.propertySpecs().values()) {
                if (spec.type() != PropertyType.STRING || !spec.hasEnum()) {
                    continue;
                }
                String problem = null;
                if (!spec.enumTokenizable()) {
                    problem = "is not tokenizable";
                } else if (!spec.enumUpperTokenizable()) {
                    problem = "is only tokenizable in lowercase";
                }
                if (problem != null) {
                    String message = "compatible '" + binding.schema() + "' in binding '" + binding.origin()
                            + "' has non-tokenizable enum for property '" + spec.name() + "': "
                            + spec.enumValues() + " " + problem;
                    diagnostics.report(DiagnosticKind.ENUM_NOT_TOKENIZABLE, message,
                            () -> new SchemaException(message, binding.origin()));
                }
            }
        }
    }

    // --- queries ---

    public State state() {
        return state;
    }

    public SourceKind kind() {
        return kind;
    }

    /** Name of the source, e.g. the file it was read from. */
    public String source() {
        return raw.source();
    }

    /** Every node, parents before children. */
    public List<PartialTreeNode> nodes() {
        requireChecked();
        return List.copyOf(nodes.values());
    }

    /** The node at {@code path}, or null. */
    public PartialTreeNode node(String path) {
        requireChecked();
        return nodes.get(path);
    }

    public PartialTreeNode root() {
        requireChecked();
        return nodes.get("/");
    }

    /** Labels defined on exactly one node. */
    public Map<String, PartialTreeNode> labels() {
        requireChecked();
        Map<String, PartialTreeNode> labels = new LinkedHashMap<>();
        labelIndex.forEach((label, owners) -> {
            if (owners.size() == 1) {
                labels.put(label, owners.get(0));
            }
        });
        return Collections.unmodifiableMap(labels);
    }

    /** The registered binding for {@code schema} and bus {@code variant}, or null. */
    public Binding binding(String schema, String variant) {
        return registry.binding(schema, variant);
    }

    private void requireChecked() {
        if (state != State.CHECKED) {
            throw new StateException("Partial tree not processed: state=" + state, raw.source());
        }
    }

    // --- package internals ---

    PartialTreeNode lookup(String path) {
        return nodes.get(path);
    }

    /**
     * A reference token resolved within this tree: {@code &label}, {@code /path}, a numeric
     * {@code phandle}, or for configuration trees a bare label.
     *
     * @return the node, or null when nothing in this tree matches
     * @throws PropertyException if a label is defined on more than one node
     */
    PartialTreeNode referencedNode(JsonNode token) {
        if (token.isIntegralNumber()) {
            return byPhandle(token.asLong());
        }
        if (!token.isTextual()) {
            return null;
        }
        String text = token.asText();
        if (text.startsWith("/")) {
            return nodes.get(text);
        }
        if (text.startsWith("&")) {
            return byLabel(text.substring(1));
        }
        return kind == SourceKind.CONFIG ? byLabel(text) : null;
    }

    /** Like {@link #referencedNode(JsonNode)}, falling back to {@code scope}. */
    Node resolveReference(JsonNode token, ReferenceScope scope) {
        Node own = referencedNode(token);
        if (own != null || !token.isTextual()) {
            return own;
        }
        String text = token.asText();
        if (text.startsWith("/")) {
            return scope.nodeByPath(text);
        }
        return scope.nodeByLabel(text.startsWith("&") ? text.substring(1) : text);
    }

    private PartialTreeNode byLabel(String label) {
        List<PartialTreeNode> owners = labelIndex.get(label);
        if (owners == null) {
            return null;
        }
        if (owners.size() > 1) {
            List<String> paths = new ArrayList<>();
            owners.forEach(owner -> paths.add(owner.path()));
            throw new PropertyException(
                    "label '" + label + "' in " + raw.source() + " is ambiguous: " + paths, paths.get(0), null);
        }
        return owners.get(0);
    }

    private PartialTreeNode byPhandle(long phandle) {
        if (phandle == 0) {
            return null;
        }
        for (PartialTreeNode node : nodes.values()) {
            JsonNode value = node.raw().property("phandle");
            if (value != null && value.isIntegralNumber() && value.asLong() == phandle) {
                return node;
            }
        }
        return null;
    }

    SpecifierResolver specifiers() {
        return specifiers;
    }

    Diagnostics diagnostics() {
        return diagnostics;
    }

    TreeOptions options() {
        return options;
    }

    BindingRegistry registry() {
        return registry;
    }

    SourceDriver driver() {
        return driver;
    }
}
