package io.settingstree.core.tree;

import io.settingstree.core.binding.Binding;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.model.RawNode;
import io.settingstree.core.model.SourceKind;
import java.util.List;
import java.util.Map;

/**
 * The few places where building a hardware tree differs from building a configuration tree.
 * Everything else in {@link PartialTree} is shared.
 */
sealed interface SourceDriver permits HardwareDriver, ConfigDriver {

    SourceKind kind();

    /** Schema ids listed on a raw node, in source order. */
    List<String> schemas(RawNode raw);

    /** Whether the raw node is enabled. */
    boolean enabled(RawNode raw);

    /** Raw properties that never need a declaration in a binding. */
    boolean isImplicitlyDeclared(String propertyName);

    /** Called before bindings are matched; parent nodes are complete. */
    void beforeBindings(PartialTreeNode node);

    /** The binding for one of the node's schema ids, or null. */
    Binding bindingFor(PartialTreeNode node, String schema);

    /** A binding synthesized from the node's raw properties, or null if none is configured. */
    Binding inferredBinding(PartialTreeNode node);

    /** Types used for well-known properties of nodes that have no binding. */
    Map<String, PropertySpec> defaultSpecs();

    /** Called once bindings are matched and the node's own properties checked. */
    void afterBindings(PartialTreeNode node);

    /** Called after the node's properties are resolved; every node of the tree exists. */
    void resolveCrossReferences(PartialTreeNode node);

    /** Tree-wide sanity checks on one node, run last. */
    void check(PartialTreeNode node);

    /** Nodes this node depends on beyond its properties, e.g. interrupt controllers. */
    List<Node> sourceDependencies(PartialTreeNode node);
}
