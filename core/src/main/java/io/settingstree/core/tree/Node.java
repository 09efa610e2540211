package io.settingstree.core.tree;

import io.settingstree.core.binding.Binding;
import java.util.List;
import java.util.Map;

/**
 * A typed node: either a node of one source tree or a merged entity combining the nodes of every
 * source at the same path.
 *
 * <p>
 * Relatives are looked up by path in the owning tree on every call.
 */
public interface Node {

    /** Absolute path, {@code /} for the root. */
    String path();

    /** Last path segment, {@code /} for the root. */
    String name();

    /** The parent, or null for the root. */
    Node parent();

    /** Children in source order. */
    List<? extends Node> children();

    List<String> labels();

    /** Schema ids listed on the node, in source order. */
    List<String> schemas();

    /** Matched bindings: explicit schema matches first, then inherited child bindings. */
    List<Binding> bindings();

    /** The schema ids for which a binding was found. */
    List<String> matchingSchemas();

    /** Resolved properties by name, in binding declaration order. */
    Map<String, ? extends Property> properties();

    /** Returns the resolved property named {@code name}, or null. */
    default Property property(String name) {
        return properties().get(name);
    }

    boolean enabled();

    default NodeKey key() {
        return NodeKey.of(path());
    }

    /** Origin files of the matched bindings. */
    default List<String> bindingOrigins() {
        return bindings().stream().map(Binding::origin).toList();
    }
}
