package io.settingstree.core.tree;

import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.binding.PropertyType;
import io.settingstree.core.binding.PropertyType.ValueShape;
import io.settingstree.core.binding.Tokens;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A resolved property. The Java type of {@link #value()} follows the declared type's shape:
 *
 * <ul>
 *   <li>boolean: {@link Boolean}
 *   <li>integers: {@link Long}, integer arrays: {@code List<Long>}
 *   <li>byte arrays: {@code byte[]}
 *   <li>strings: {@link String}, string arrays: {@code List<String>}
 *   <li>floats and doubles: {@link Double}, their arrays: {@code List<Double>}
 *   <li>references and paths: {@link Node}, reference lists: {@code List<Node>}
 *   <li>indexed reference lists: {@code List<ControllerAndData>}, with null for empty elements
 * </ul>
 *
 * <p>
 * Properties of type {@code compound} are validated but never exposed.
 */
public interface Property {

    PropertySpec spec();

    /** The node carrying this property. */
    Node node();

    /** The resolved value, never null for an exposed property. */
    Object value();

    default String name() {
        return spec().name();
    }

    default PropertyType type() {
        return spec().type();
    }

    /** The declared description without surrounding whitespace, or null. */
    default String description() {
        return spec().description() == null ? null : spec().description().strip();
    }

    default boolean asBoolean() {
        return as(Boolean.class);
    }

    default long asLong() {
        return as(Long.class);
    }

    default double asDouble() {
        return as(Double.class);
    }

    default String asString() {
        return as(String.class);
    }

    default byte[] asBytes() {
        return as(byte[].class);
    }

    default Node asNode() {
        return as(Node.class);
    }

    default List<Long> asLongs() {
        return asList(ValueShape.INT_ARRAY, Long.class);
    }

    default List<Double> asDoubles() {
        return asList(ValueShape.FLOAT_ARRAY, Double.class);
    }

    default List<String> asStrings() {
        return asList(ValueShape.STRING_ARRAY, String.class);
    }

    default List<Node> asNodes() {
        return asList(ValueShape.REFERENCE_ARRAY, Node.class);
    }

    default List<ControllerAndData> asSpecifiers() {
        return asList(ValueShape.SPECIFIER_ARRAY, ControllerAndData.class);
    }

    /**
     * The value as identifier-safe tokens. Only meaningful for string and string-array properties
     * whose enum is tokenizable.
     */
    default List<String> valueAsTokens() {
        List<String> tokens = new ArrayList<>();
        for (Object element : Values.elements(value())) {
            tokens.add(Tokens.asToken(String.valueOf(element)));
        }
        return tokens;
    }

    /** Positions of the value's elements in the declared enum, or null without an enum. */
    default List<Integer> enumIndices() {
        if (!spec().hasEnum()) {
            return null;
        }
        List<Integer> indices = new ArrayList<>();
        for (Object element : Values.elements(value())) {
            indices.add(Values.indexIn(element, spec().enumValues()));
        }
        return indices;
    }

    private <T> T as(Class<T> expected) {
        Object value = value();
        if (!expected.isInstance(value)) {
            throw new IllegalStateException("Property '" + name() + "' on " + node().path() + " has type '"
                    + type().tag() + "', which is not a " + expected.getSimpleName());
        }
        return expected.cast(value);
    }

    private <T> List<T> asList(ValueShape shape, Class<T> element) {
        if (type().shape() != shape) {
            throw new IllegalStateException("Property '" + name() + "' on " + node().path() + " has type '"
                    + type().tag() + "', which is not a list of " + element.getSimpleName());
        }
        List<T> elements = new ArrayList<>();
        for (Object value : as(List.class)) {
            elements.add(element.cast(value));
        }
        return Collections.unmodifiableList(elements);
    }
}
