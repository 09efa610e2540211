package io.settingstree.core.merge;

import io.settingstree.core.binding.Binding;
import io.settingstree.core.error.MergeException;
import io.settingstree.core.model.SourceKind;
import io.settingstree.core.tree.Node;
import io.settingstree.core.tree.PartialTreeNode;
import io.settingstree.core.tree.PartialTreeProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All nodes at one path, across every source of a {@link MergedTree}. Property names of the
 * contributing nodes are disjoint, so the entity's properties are their union.
 */
public final class MergedEntity implements Node {

    private final MergedTree tree;
    private final String path;
    private final List<PartialTreeNode> nodes = new ArrayList<>();
    private final Map<String, MergedProperty> properties = new LinkedHashMap<>();
    private int ordinal = -1;

    MergedEntity(MergedTree tree, PartialTreeNode first) {
        this.tree = tree;
        this.path = first.path();
        add(first);
    }

    void add(PartialTreeNode node) {
        for (PartialTreeProperty property : node.properties().values()) {
            MergedProperty existing = properties.get(property.name());
            if (existing != null) {
                throw new MergeException(
                        "Property '" + property.name() + "' of " + path + " is set in both "
                                + existing.source().node().path() + " in " + sourceOf(existing) + " and "
                                + node.source(),
                        path);
            }
        }
        nodes.add(node);
        for (PartialTreeProperty property : node.properties().values()) {
            properties.put(property.name(), new MergedProperty(property, this));
        }
    }

    private static String sourceOf(MergedProperty property) {
        return ((PartialTreeNode) property.source().node()).source();
    }

    MergedTree tree() {
        return tree;
    }

    void setOrdinal(int ordinal) {
        this.ordinal = ordinal;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String name() {
        return nodes.get(0).name();
    }

    @Override
    public MergedEntity parent() {
        PartialTreeNode parent = nodes.get(0).parent();
        return parent == null ? null : tree.nodeByPath(parent.path());
    }

    /** Children of every contributing node, in source order. */
    @Override
    public List<MergedEntity> children() {
        Set<String> paths = new LinkedHashSet<>();
        for (PartialTreeNode node : nodes) {
            node.children().forEach(child -> paths.add(child.path()));
        }
        List<MergedEntity> children = new ArrayList<>();
        for (String childPath : paths) {
            MergedEntity child = tree.nodeByPath(childPath);
            if (child != null) {
                children.add(child);
            }
        }
        return children;
    }

    @Override
    public List<String> labels() {
        Set<String> labels = new LinkedHashSet<>();
        nodes.forEach(node -> labels.addAll(node.labels()));
        return List.copyOf(labels);
    }

    @Override
    public List<String> schemas() {
        Set<String> schemas = new LinkedHashSet<>();
        nodes.forEach(node -> schemas.addAll(node.schemas()));
        return List.copyOf(schemas);
    }

    @Override
    public List<Binding> bindings() {
        List<Binding> bindings = new ArrayList<>();
        nodes.forEach(node -> bindings.addAll(node.bindings()));
        return Collections.unmodifiableList(bindings);
    }

    @Override
    public List<String> matchingSchemas() {
        Set<String> schemas = new LinkedHashSet<>();
        nodes.forEach(node -> schemas.addAll(node.matchingSchemas()));
        return List.copyOf(schemas);
    }

    @Override
    public Map<String, MergedProperty> properties() {
        return Collections.unmodifiableMap(properties);
    }

    @Override
    public MergedProperty property(String name) {
        return properties.get(name);
    }

    /** True only when every contributing node is enabled. */
    @Override
    public boolean enabled() {
        return nodes.stream().allMatch(PartialTreeNode::enabled);
    }

    /** Contributing nodes in source order. */
    public List<PartialTreeNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** The contributing node of the source of {@code kind}, or null. */
    public PartialTreeNode node(SourceKind kind) {
        for (PartialTreeNode node : nodes) {
            if (node.kind() == kind) {
                return node;
            }
        }
        return null;
    }

    /** Names of the sources that contributed a node. */
    public List<String> sources() {
        List<String> sources = new ArrayList<>();
        nodes.forEach(node -> sources.add(node.source()));
        return sources;
    }

    /**
     * The dependency ordinal: lower than the ordinal of every entity depending on this one.
     *
     * @return the ordinal, or -1 until the merged tree has assigned ordinals
     */
    public int ordinal() {
        return ordinal;
    }

    /** Entities this entity directly depends on. */
    public List<MergedEntity> dependsOn() {
        return tree.entities(tree.graph().dependsOn(path));
    }

    /** Entities directly depending on this entity. */
    public List<MergedEntity> requiredBy() {
        return tree.entities(tree.graph().requiredBy(path));
    }

    @Override
    public String toString() {
        return "MergedEntity{" + path + ", sources=" + sources() + ", ordinal=" + ordinal + "}";
    }
}
