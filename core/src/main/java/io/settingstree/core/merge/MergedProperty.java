package io.settingstree.core.merge;

import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.tree.ControllerAndData;
import io.settingstree.core.tree.Node;
import io.settingstree.core.tree.Property;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A property of a {@link MergedEntity}. Node references in the value are replaced by the merged
 * entities at the same paths.
 */
public final class MergedProperty implements Property {

    private final Property source;
    private final MergedEntity entity;

    MergedProperty(Property source, MergedEntity entity) {
        this.source = source;
        this.entity = entity;
    }

    @Override
    public PropertySpec spec() {
        return source.spec();
    }

    @Override
    public MergedEntity node() {
        return entity;
    }

    /** The property as resolved in its own source. */
    public Property source() {
        return source;
    }

    @Override
    public Object value() {
        Object value = source.value();
        switch (spec().type().shape()) {
            case REFERENCE:
            case PATH:
                return toEntity((Node) value);
            case REFERENCE_ARRAY: {
                List<Node> nodes = new ArrayList<>();
                for (Object element : (List<?>) value) {
                    nodes.add(toEntity((Node) element));
                }
                return Collections.unmodifiableList(nodes);
            }
            case SPECIFIER_ARRAY: {
                List<ControllerAndData> elements = new ArrayList<>();
                for (Object element : (List<?>) value) {
                    ControllerAndData data = (ControllerAndData) element;
                    elements.add(data == null ? null : data.withController(toEntity(data.controller())));
                }
                return Collections.unmodifiableList(elements);
            }
            default:
                return value;
        }
    }

    private Node toEntity(Node node) {
        MergedEntity merged = entity.tree().nodeByPath(node.path());
        return merged == null ? node : merged;
    }

    @Override
    public String toString() {
        return "MergedProperty{" + entity.path() + ":" + name() + "}";
    }
}
