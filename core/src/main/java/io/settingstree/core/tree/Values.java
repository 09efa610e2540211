package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.binding.ByteValues;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** Comparisons between resolved values and the JSON values found in bindings. */
final class Values {

    private Values() {
        // utility class
    }

    /** The scalar sub-values of {@code value}: the list elements, or the value itself. */
    static List<?> elements(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        return Arrays.asList(value);
    }

    /** True when a resolved scalar equals a binding value such as an enum entry. */
    static boolean scalarEquals(Object value, JsonNode json) {
        if (value instanceof Long l) {
            return json.isIntegralNumber() && json.asLong() == l;
        }
        if (value instanceof Double d) {
            return json.isNumber() && json.asDouble() == d;
        }
        if (value instanceof Boolean b) {
            return json.isBoolean() && json.asBoolean() == b;
        }
        if (value instanceof String s) {
            return json.isTextual() && json.asText().equals(s);
        }
        return false;
    }

    /** Index of {@code value} among {@code enumValues}, or -1. */
    static int indexIn(Object value, List<JsonNode> enumValues) {
        for (int i = 0; i < enumValues.size(); i++) {
            if (scalarEquals(value, enumValues.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /** Whole-value equality against a {@code const:} value. */
    static boolean constEquals(Object value, JsonNode constValue) {
        if (value instanceof byte[] bytes) {
            return Arrays.equals(bytes, ByteValues.fromDefault(constValue));
        }
        if (value instanceof List<?> list) {
            if (!constValue.isArray() || constValue.size() != list.size()) {
                return false;
            }
            for (int i = 0; i < list.size(); i++) {
                if (!scalarEquals(list.get(i), constValue.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return scalarEquals(value, constValue);
    }

    /** Human-readable rendering for error messages. */
    static String display(Object value) {
        if (value instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        }
        if (value instanceof Node node) {
            return node.path();
        }
        return Objects.toString(value);
    }
}
