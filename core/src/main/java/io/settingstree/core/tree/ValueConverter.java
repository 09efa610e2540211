package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.binding.ByteValues;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.binding.PropertyType;
import io.settingstree.core.error.PropertyException;
import io.settingstree.core.model.SourceKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts raw property values to typed values. One conversion is registered per
 * {@code (PropertyType, SourceKind)} pair; a type with no entry for a source kind cannot appear in
 * that source's bindings.
 */
final class ValueConverter {

    /** One raw value to convert, with everything a conversion may need to report or resolve. */
    record Request(PartialTreeNode node, PropertySpec spec, JsonNode raw, ReferenceScope scope) {

        String name() {
            return spec.name();
        }

        PropertyException error(String message) {
            return new PropertyException(message, node.path(), spec.name());
        }

        /** Standard "expected ... to be X, not Y" failure. */
        PropertyException expected(String what) {
            return error("expected property '" + spec.name() + "' on " + node.path() + " in " + node.source()
                    + " to be " + what + ", not '" + raw + "' (binding " + spec.origin() + ")");
        }
    }

    @FunctionalInterface
    interface Conversion {
        Object convert(Request request);
    }

    private static final Map<SourceKind, Map<PropertyType, Conversion>> TABLE = new EnumMap<>(SourceKind.class);

    static {
        Map<PropertyType, Conversion> hardware = new EnumMap<>(PropertyType.class);
        hardware.put(PropertyType.BOOLEAN, ValueConverter::hardwareBoolean);
        hardware.put(PropertyType.INT, ValueConverter::hardwareInt);
        hardware.put(PropertyType.ARRAY, ValueConverter::hardwareInts);
        hardware.put(PropertyType.UINT8_ARRAY, ValueConverter::bytes);
        hardware.put(PropertyType.STRING, ValueConverter::string);
        hardware.put(PropertyType.STRING_ARRAY, ValueConverter::hardwareStrings);
        hardware.put(PropertyType.PHANDLE, ValueConverter::reference);
        hardware.put(PropertyType.PHANDLES, ValueConverter::references);
        hardware.put(PropertyType.PHANDLE_ARRAY, r -> r.node.tree().specifiers().resolve(r.node, r.spec, r.raw));
        hardware.put(PropertyType.PATH, ValueConverter::reference);
        // validated for presence only, never exposed
        hardware.put(PropertyType.COMPOUND, r -> null);
        TABLE.put(SourceKind.HARDWARE, Collections.unmodifiableMap(hardware));

        Map<PropertyType, Conversion> config = new EnumMap<>(PropertyType.class);
        config.put(PropertyType.BOOLEAN, ValueConverter::configBoolean);
        config.put(PropertyType.UINT8_ARRAY, ValueConverter::bytes);
        config.put(PropertyType.STRING, ValueConverter::string);
        config.put(PropertyType.STRING_ARRAY, ValueConverter::configStrings);
        config.put(PropertyType.POINTER, ValueConverter::reference);
        config.put(PropertyType.POINTER_ARRAY, ValueConverter::references);
        for (PropertyType type : PropertyType.values()) {
            if (!type.isAvailableIn(SourceKind.CONFIG) || config.containsKey(type)) {
                continue;
            }
            switch (type.shape()) {
                case INT -> config.put(type, ValueConverter::configInt);
                case INT_ARRAY -> config.put(type, ValueConverter::configInts);
                case FLOAT -> config.put(type, ValueConverter::configFloat);
                case FLOAT_ARRAY -> config.put(type, ValueConverter::configFloats);
                default -> {
                    // node-typed properties are child bindings, not values
                }
            }
        }
        TABLE.put(SourceKind.CONFIG, Collections.unmodifiableMap(config));
    }

    private ValueConverter() {
        // utility class
    }

    /**
     * Converts a raw value present on a node.
     *
     * @return the typed value, or null for types that are never exposed
     * @throws PropertyException if the raw value does not fit the declared type
     */
    static Object convert(PartialTreeNode node, PropertySpec spec, JsonNode raw, ReferenceScope scope) {
        Conversion conversion = TABLE.get(node.kind()).get(spec.type());
        if (conversion == null) {
            throw new PropertyException(
                    "type '" + spec.type().tag() + "' of property '" + spec.name() + "' in " + spec.origin()
                            + " is not supported for " + node.kind().name().toLowerCase(Locale.ROOT)
                            + " nodes",
                    node.path(),
                    spec.name());
        }
        return conversion.convert(new Request(node, spec, raw, scope));
    }

    /**
     * Converts a {@code default:} or {@code const:} value of a binding. The binding checker has
     * already verified that the value fits the type.
     */
    static Object fromBindingValue(PropertySpec spec, JsonNode value) {
        switch (spec.type().shape()) {
            case BOOLEAN:
                return value.asBoolean();
            case INT:
                return value.isTextual() ? IntExpression.evaluate(value.asText()) : value.asLong();
            case INT_ARRAY: {
                List<Long> longs = new ArrayList<>();
                value.forEach(element -> longs.add(
                        element.isTextual() ? IntExpression.evaluate(element.asText()) : element.asLong()));
                return Collections.unmodifiableList(longs);
            }
            case BYTES:
                return ByteValues.fromDefault(value);
            case STRING:
                return value.asText();
            case STRING_ARRAY: {
                List<String> strings = new ArrayList<>();
                value.forEach(element -> strings.add(element.asText()));
                return Collections.unmodifiableList(strings);
            }
            case FLOAT:
                return value.asDouble();
            case FLOAT_ARRAY: {
                List<Double> doubles = new ArrayList<>();
                value.forEach(element -> doubles.add(element.asDouble()));
                return Collections.unmodifiableList(doubles);
            }
            default:
                throw new IllegalArgumentException("type '" + spec.type().tag() + "' has no literal values");
        }
    }

    // --- hardware ---

    private static Object hardwareBoolean(Request r) {
        if (!Cells.flatten(r.raw).isEmpty()) {
            throw r.error("'" + r.name() + "' in " + r.node.path() + " is defined with 'type: boolean' in "
                    + r.spec.origin() + ", but is assigned a value ('" + r.raw + "') instead of being empty ('"
                    + r.name() + ";')");
        }
        return Boolean.TRUE;
    }

    private static Object hardwareInt(Request r) {
        List<JsonNode> elements = Cells.flatten(r.raw);
        if (elements.size() != 1 || !elements.get(0).isIntegralNumber()) {
            throw r.expected("assigned with '" + r.name() + " = < (number) >;'");
        }
        return elements.get(0).asLong();
    }

    private static Object hardwareInts(Request r) {
        List<Long> values = new ArrayList<>();
        for (JsonNode element : Cells.flatten(r.raw)) {
            if (!element.isIntegralNumber()) {
                throw r.expected("assigned with '" + r.name() + " = < (number) (number) ... >;'");
            }
            values.add(element.asLong());
        }
        return Collections.unmodifiableList(values);
    }

    private static Object hardwareStrings(Request r) {
        if (r.raw.isTextual()) {
            return List.of(r.raw.asText());
        }
        return configStrings(r);
    }

    // --- configuration ---

    private static Object configBoolean(Request r) {
        if (!r.raw.isBoolean()) {
            throw r.expected("a boolean");
        }
        return r.raw.asBoolean();
    }

    private static Object configInt(Request r) {
        return checkRange(r, toLong(r, r.raw));
    }

    private static Object configInts(Request r) {
        if (!r.raw.isArray()) {
            throw r.expected("a list of integers");
        }
        List<Long> values = new ArrayList<>();
        for (JsonNode element : r.raw) {
            values.add(checkRange(r, toLong(r, element)));
        }
        return Collections.unmodifiableList(values);
    }

    private static long toLong(Request r, JsonNode value) {
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw r.error("value '" + value + "' of property '" + r.name() + "' on " + r.node.path()
                        + " does not fit in 64 bits");
            }
            return value.asLong();
        }
        if (value.isTextual() && IntExpression.isCandidate(value.asText())) {
            try {
                return IntExpression.evaluate(value.asText());
            } catch (IllegalArgumentException | ArithmeticException e) {
                throw new PropertyException(
                        "expected property '" + r.name() + "' on " + r.node.path() + " in " + r.node.source()
                                + " to be an integer expression, not '" + value.asText() + "': " + e.getMessage(),
                        e,
                        r.node.path(),
                        r.name());
            }
        }
        throw r.error("expected property '" + r.name() + "' on " + r.node.path() + " in " + r.node.source()
                + " to be an integer, not '" + value + "'");
    }

    private static long checkRange(Request r, long value) {
        PropertyType type = r.spec.type();
        if (type.isSized() && (value < type.min() || value > type.max())) {
            throw r.error("value " + value + " of property '" + r.name() + "' on " + r.node.path()
                    + " is out of range for type '" + type.tag() + "' [" + type.min() + ", " + type.max() + "]");
        }
        return value;
    }

    private static Object configFloat(Request r) {
        if (!r.raw.isNumber()) {
            throw r.expected("a float");
        }
        return r.raw.asDouble();
    }

    private static Object configFloats(Request r) {
        if (!r.raw.isArray()) {
            throw r.expected("a list of floats");
        }
        List<Double> values = new ArrayList<>();
        for (JsonNode element : r.raw) {
            if (!element.isNumber()) {
                throw r.error("expected property '" + r.name() + "' on " + r.node.path() + " in "
                        + r.node.source() + " to be a list of floats, but it contains '" + element + "'");
            }
            values.add(element.asDouble());
        }
        return Collections.unmodifiableList(values);
    }

    private static Object configStrings(Request r) {
        if (!r.raw.isArray()) {
            throw r.expected("a list of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : r.raw) {
            if (!element.isTextual()) {
                throw r.error("expected property '" + r.name() + "' on " + r.node.path() + " in "
                        + r.node.source() + " to be a list of strings, but it contains '" + element + "'");
            }
            values.add(element.asText());
        }
        return Collections.unmodifiableList(values);
    }

    // --- shared ---

    private static Object string(Request r) {
        if (!r.raw.isTextual()) {
            throw r.expected("a string");
        }
        return r.raw.asText();
    }

    private static Object bytes(Request r) {
        JsonNode raw = r.raw;
        try {
            if (raw.isBinary()) {
                return raw.binaryValue();
            }
            if (raw.isTextual()) {
                return ByteValues.fromHex(raw.asText());
            }
            if (raw.isIntegralNumber() && r.node.kind() == SourceKind.CONFIG) {
                return ByteValues.fromLong(raw.asLong());
            }
            if (raw.isArray()) {
                return ByteValues.fromInts(raw);
            }
        } catch (IllegalArgumentException | IOException e) {
            throw new PropertyException(
                    "value of property '" + r.name() + "' (" + raw + ") on " + r.node.path() + " in "
                            + r.node.source() + " is not a valid byte array: " + e.getMessage(),
                    e,
                    r.node.path(),
                    r.name());
        }
        throw r.expected("a byte array");
    }

    private static Object reference(Request r) {
        if (!r.raw.isTextual() && !r.raw.isIntegralNumber()) {
            throw r.expected("'&foo' or '/bar/foo'");
        }
        return resolve(r, r.raw);
    }

    private static Object references(Request r) {
        boolean phandles = r.node.kind() == SourceKind.HARDWARE;
        List<JsonNode> elements = phandles ? Cells.flatten(r.raw) : listOf(r);
        boolean labels = false;
        boolean paths = false;
        List<Node> nodes = new ArrayList<>();
        for (JsonNode element : elements) {
            if (phandles && element.isIntegralNumber()) {
                nodes.add(resolve(r, element));
                continue;
            }
            if (!element.isTextual()) {
                throw r.error("expected property '" + r.name() + "' on " + r.node.path() + " in "
                        + r.node.source() + " to be a list of '&foo' or '/bar/foo', but it contains '" + element
                        + "'");
            }
            labels |= !element.asText().startsWith("/");
            paths |= element.asText().startsWith("/");
            nodes.add(resolve(r, element));
        }
        if (labels && paths) {
            throw r.error("property '" + r.name() + "' on " + r.node.path() + " in " + r.node.source()
                    + " mixes label references and path references");
        }
        return Collections.unmodifiableList(nodes);
    }

    private static List<JsonNode> listOf(Request r) {
        if (!r.raw.isArray()) {
            throw r.expected("a list of pointers");
        }
        List<JsonNode> elements = new ArrayList<>();
        r.raw.forEach(elements::add);
        return elements;
    }

    private static Node resolve(Request r, JsonNode token) {
        Node target = r.node.tree().resolveReference(token, r.scope);
        if (target == null) {
            throw r.error("could not resolve property '" + r.name() + "' on " + r.node.path() + " in "
                    + r.node.source() + " to a node: '" + token.asText() + "'");
        }
        return target;
    }
}
