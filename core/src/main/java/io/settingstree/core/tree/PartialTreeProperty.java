package io.settingstree.core.tree;

import io.settingstree.core.binding.PropertySpec;
import java.util.Objects;

/** A resolved property of a {@link PartialTreeNode}. */
public record PartialTreeProperty(PropertySpec spec, PartialTreeNode node, Object value) implements Property {

    public PartialTreeProperty {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String toString() {
        return "PartialTreeProperty{" + node.path() + ":" + spec.name() + "=" + Values.display(value) + "}";
    }
}
