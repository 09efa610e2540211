package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 32-bit cell arithmetic for hardware values. Raw cell lists are JSON arrays whose elements are
 * integers or reference strings; nested arrays are flattened.
 */
final class Cells {

    static final long CELL_MASK = 0xFFFF_FFFFL;

    private Cells() {
        // utility class
    }

    /** Flattens a raw value into its elements. A missing, null or {@code true} marker value has none. */
    static List<JsonNode> flatten(JsonNode raw) {
        List<JsonNode> elements = new ArrayList<>();
        if (raw == null || raw.isNull() || raw.isMissingNode() || (raw.isBoolean() && raw.asBoolean())) {
            return elements;
        }
        if (!raw.isArray()) {
            elements.add(raw);
            return elements;
        }
        for (JsonNode element : raw) {
            elements.addAll(flatten(element));
        }
        return elements;
    }

    /** True for {@code &label} and {@code /path} reference tokens. */
    static boolean isReference(JsonNode element) {
        if (!element.isTextual()) {
            return false;
        }
        String text = element.asText();
        return text.startsWith("&") || text.startsWith("/");
    }

    /** Converts every element to a cell, or returns null if one is not a 32-bit unsigned integer. */
    static long[] numbers(List<JsonNode> elements) {
        long[] cells = new long[elements.size()];
        for (int i = 0; i < cells.length; i++) {
            JsonNode element = elements.get(i);
            if (!element.isIntegralNumber() || element.asLong() < 0 || element.asLong() > CELL_MASK) {
                return null;
            }
            cells[i] = element.asLong();
        }
        return cells;
    }

    /** Joins {@code count} cells starting at {@code from} into one big-endian number. */
    static long toNumber(long[] cells, int from, int count) {
        long value = 0;
        for (int i = from; i < from + count; i++) {
            value = (value << 32) | (cells[i] & CELL_MASK);
        }
        return value;
    }

    /** Bitwise AND, right-aligned, padding the shorter operand with ones. */
    static long[] and(long[] a, long[] b) {
        return combine(a, b, CELL_MASK, true);
    }

    /** Bitwise OR, right-aligned, padding the shorter operand with zeros. */
    static long[] or(long[] a, long[] b) {
        return combine(a, b, 0, false);
    }

    static long[] not(long[] a) {
        long[] result = new long[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = ~a[i] & CELL_MASK;
        }
        return result;
    }

    /** The last {@code count} cells. */
    static long[] tail(long[] a, int count) {
        return Arrays.copyOfRange(a, a.length - count, a.length);
    }

    static long[] concat(long[] a, long[] b) {
        long[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private static long[] combine(long[] a, long[] b, long pad, boolean and) {
        int length = Math.max(a.length, b.length);
        long[] result = new long[length];
        for (int i = 0; i < length; i++) {
            long x = cellAt(a, i - (length - a.length), pad);
            long y = cellAt(b, i - (length - b.length), pad);
            result[i] = and ? x & y : x | y;
        }
        return result;
    }

    private static long cellAt(long[] cells, int index, long pad) {
        return index < 0 ? pad : cells[index];
    }
}
