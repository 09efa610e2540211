package io.settingstree.core.merge;

import io.settingstree.core.binding.Binding;
import io.settingstree.core.binding.ChildBinding;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.config.Diagnostics;
import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.GraphException;
import io.settingstree.core.error.StateException;
import io.settingstree.core.graph.DependencyGraph;
import io.settingstree.core.tree.ControllerAndData;
import io.settingstree.core.tree.Node;
import io.settingstree.core.tree.NodeKey;
import io.settingstree.core.tree.PartialTree;
import io.settingstree.core.tree.PartialTreeNode;
import io.settingstree.core.tree.ReferenceScope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges processed partial trees into one tree of entities and orders them by dependency.
 *
 * <p>
 * Sources are added base first: a source may reference entities of sources added before it.
 * {@link #process()} runs once; the tree is read-only afterwards.
 *
 * <pre>{@code
 * MergedTree merged = new MergedTree(options)
 *         .addSource(PartialTree.fromBindingDirs(SourceKind.HARDWARE, hardware, options))
 *         .addSource(PartialTree.fromBindingDirs(SourceKind.CONFIG, config, options))
 *         .process();
 * for (MergedEntity entity : merged.entities()) { ... }
 * }</pre>
 */
public final class MergedTree implements ReferenceScope {

    private static final Logger LOG = LoggerFactory.getLogger(MergedTree.class);

    /** Orders vertex paths by {@link NodeKey}, then by path. */
    static final Comparator<String> PATH_ORDER =
            Comparator.comparing(NodeKey::of).thenComparing(Comparator.naturalOrder());

    /** Processing states, in order. */
    public enum State {
        INITIAL,
        HAS_SOURCES,
        SOURCES_FROZEN,
        HAS_ENTITIES,
        HAS_ORDINALS,
        PROCESSED
    }

    private final Diagnostics diagnostics;
    private final Map<String, String> vendorPrefixes;
    private final List<PartialTree> sources = new ArrayList<>();
    private final Map<String, MergedEntity> entities = new LinkedHashMap<>();
    private final Map<String, List<MergedEntity>> labelIndex = new LinkedHashMap<>();
    private final DependencyGraph<String> graph = new DependencyGraph<>(PATH_ORDER);
    private Map<String, MergedEntity> uniqueLabels = Map.of();
    private LookupTables tables;
    private State state = State.INITIAL;

    /** A merged tree whose vendor prefixes are read from {@link TreeOptions#vendorPrefixes()}, if set. */
    public MergedTree(TreeOptions options) {
        this(options, options.vendorPrefixes() == null ? Map.of() : VendorPrefixes.load(options.vendorPrefixes()));
    }

    public MergedTree(TreeOptions options, Map<String, String> vendorPrefixes) {
        Objects.requireNonNull(options, "options must not be null");
        this.diagnostics = options.diagnostics();
        this.vendorPrefixes = Map.copyOf(Objects.requireNonNull(vendorPrefixes, "vendorPrefixes must not be null"));
    }

    /**
     * Adds an unprocessed source. Sources are processed and merged in the order they are added.
     *
     * @throws StateException if the tree is already processing
     */
    public MergedTree addSource(PartialTree source) {
        Objects.requireNonNull(source, "source must not be null");
        if (state != State.INITIAL && state != State.HAS_SOURCES) {
            throw new StateException("Cannot add source " + source.source() + " in state " + state, source.source());
        }
        sources.add(source);
        state = State.HAS_SOURCES;
        return this;
    }

    /**
     * Processes every source, merges nodes by path, assigns dependency ordinals and builds the
     * lookup tables.
     *
     * @throws StateException if there is no source or the tree was already processed
     * @throws io.settingstree.core.error.SettingsTreeException on the first invalid source, a merge
     *     conflict or a dependency loop
     */
    public MergedTree process() {
        if (state != State.HAS_SOURCES) {
            throw new StateException("Merged tree cannot be processed in state " + state, null);
        }
        state = State.SOURCES_FROZEN;

        for (PartialTree source : sources) {
            source.process(this);
            for (PartialTreeNode node : source.nodes()) {
                MergedEntity entity = entities.get(node.path());
                if (entity == null) {
                    entity = new MergedEntity(this, node);
                    entities.put(node.path(), entity);
                } else {
                    entity.add(node);
                }
                for (String label : node.labels()) {
                    List<MergedEntity> owners = labelIndex.computeIfAbsent(label, k -> new ArrayList<>());
                    if (!owners.contains(entity)) {
                        owners.add(entity);
                    }
                }
            }
            uniqueLabels = uniqueLabels();
            LOG.debug("Source merged: source={}, entities={}", source.source(), entities.size());
        }
        state = State.HAS_ENTITIES;

        assignOrdinals();
        state = State.HAS_ORDINALS;

        tables = LookupTables.build(List.copyOf(entities.values()), uniqueLabels, vendorPrefixes, diagnostics);
        state = State.PROCESSED;
        LOG.info("Merged tree processed: sources={}, entities={}, labels={}",
                sources.size(), entities.size(), uniqueLabels.size());
        return this;
    }

    private Map<String, MergedEntity> uniqueLabels() {
        Map<String, MergedEntity> labels = new LinkedHashMap<>();
        labelIndex.forEach((label, owners) -> {
            if (owners.size() == 1) {
                labels.put(label, owners.get(0));
            }
        });
        return Collections.unmodifiableMap(labels);
    }

    // --- dependency graph ---

    private void assignOrdinals() {
        for (MergedEntity entity : entities.values()) {
            addToGraph(entity);
        }
        List<List<String>> sccs = graph.orderedSccs();
        int ordered = 0;
        for (List<String> scc : sccs) {
            if (scc.size() > 1) {
                List<String> loop = new ArrayList<>(scc);
                loop.sort(PATH_ORDER);
                throw new GraphException("Dependency loop detected: " + loop, loop.get(0));
            }
            ordered++;
        }
        if (ordered != entities.size()) {
            List<String> unreached = new ArrayList<>();
            for (String path : entities.keySet()) {
                if (sccs.stream().noneMatch(scc -> scc.contains(path))) {
                    unreached.add(path);
                }
            }
            throw new GraphException("Dependency loop detected: " + unreached, unreached.get(0));
        }
        int ordinal = 0;
        for (List<String> scc : sccs) {
            entities.get(scc.get(0)).setOrdinal(ordinal++);
        }
        LOG.info("Ordinals assigned: entities={}", ordinal);
    }

    private void addToGraph(MergedEntity entity) {
        if (entity.parent() == null) {
            graph.addNode(entity.path());
        }
        for (MergedEntity child : entity.children()) {
            graph.addEdge(child.path(), entity.path());
        }
        addBindingDependencies(entity, entity, entity.bindings());
        for (PartialTreeNode node : entity.nodes()) {
            for (Node dependency : node.sourceDependencies()) {
                graph.addEdge(entity.path(), dependency.path());
            }
        }
    }

    /**
     * Adds edges for the reference properties of {@code bound} declared by {@code bindings}, and
     * recursively for children bound through child bindings. All edges start at {@code owner}.
     */
    private void addBindingDependencies(MergedEntity owner, MergedEntity bound, List<Binding> bindings) {
        for (Binding binding : bindings) {
            for (PropertySpec spec : binding.propertySpecs().values()) {
                for (MergedProperty property : bound.properties().values()) {
                    if (spec.matches(property.name())) {
                        addReferenceEdges(owner, property);
                    }
                }
            }
            for (ChildBinding childBinding : binding.childBindings().values()) {
                for (MergedEntity child : bound.children()) {
                    if (childBinding.matches(child.name())) {
                        addBindingDependencies(owner, child, childBinding.bindings());
                    }
                }
            }
        }
    }

    private void addReferenceEdges(MergedEntity owner, MergedProperty property) {
        Object value = property.value();
        switch (property.type().shape()) {
            case REFERENCE:
                graph.addEdge(owner.path(), ((Node) value).path());
                break;
            case REFERENCE_ARRAY:
                for (Object element : (List<?>) value) {
                    graph.addEdge(owner.path(), ((Node) element).path());
                }
                break;
            case SPECIFIER_ARRAY:
                for (Object element : (List<?>) value) {
                    if (element != null) {
                        graph.addEdge(owner.path(), ((ControllerAndData) element).controller().path());
                    }
                }
                break;
            default:
                break;
        }
    }

    // --- ReferenceScope ---

    /** The entity with the unique label {@code label}, considering sources merged so far. */
    @Override
    public MergedEntity nodeByLabel(String label) {
        return uniqueLabels.get(label);
    }

    /** The entity at {@code path}, considering sources merged so far. */
    @Override
    public MergedEntity nodeByPath(String path) {
        return entities.get(path);
    }

    // --- queries ---

    public State state() {
        return state;
    }

    /** Sources in the order they were added. */
    public List<PartialTree> sources() {
        return Collections.unmodifiableList(sources);
    }

    /** Every entity in build order. */
    public List<MergedEntity> entities() {
        requireProcessed();
        return List.copyOf(entities.values());
    }

    /** The entity at {@code path}, or null. */
    public MergedEntity entity(String path) {
        requireProcessed();
        return entities.get(path);
    }

    public MergedEntity root() {
        requireProcessed();
        return entities.get("/");
    }

    /** Labels defined on exactly one entity. */
    public Map<String, MergedEntity> labels() {
        requireProcessed();
        return uniqueLabels;
    }

    /** Strongly connected components of the dependency graph, in dependency order. */
    public List<List<MergedEntity>> orderedSccs() {
        requireProcessed();
        List<List<MergedEntity>> sccs = new ArrayList<>();
        for (List<String> scc : graph.orderedSccs()) {
            sccs.add(entities(scc));
        }
        return Collections.unmodifiableList(sccs);
    }

    public LookupTables tables() {
        requireProcessed();
        return tables;
    }

    DependencyGraph<String> graph() {
        return graph;
    }

    List<MergedEntity> entities(List<String> paths) {
        List<MergedEntity> result = new ArrayList<>();
        for (String path : paths) {
            result.add(entities.get(path));
        }
        return Collections.unmodifiableList(result);
    }

    private void requireProcessed() {
        if (state != State.PROCESSED) {
            throw new StateException("Merged tree not processed: state=" + state, null);
        }
    }
}
