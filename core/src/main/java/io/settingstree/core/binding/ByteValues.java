package io.settingstree.core.binding;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.ByteArrayOutputStream;
import java.util.HexFormat;

/** Parsing of byte-array values written as hex strings or integer lists. */
public final class ByteValues {

    private ByteValues() {
        // utility class
    }

    /**
     * Parses hex text such as {@code "0a1b"} or {@code "0a 1b"}. Whitespace between byte pairs is
     * ignored.
     *
     * @throws IllegalArgumentException if the text is not an even number of hex digits
     */
    public static byte[] fromHex(String text) {
        String digits = text.replaceAll("\\s+", "");
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("odd number of hex digits in '" + text + "'");
        }
        return HexFormat.of().parseHex(digits);
    }

    /** True when {@code text} parses with {@link #fromHex(String)}. */
    public static boolean isHex(String text) {
        try {
            fromHex(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Converts a list of integers in {@code [0, 255]} to bytes.
     *
     * @throws IllegalArgumentException if an element is not an integer in range
     */
    public static byte[] fromInts(JsonNode array) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (JsonNode element : array) {
            if (!isByte(element)) {
                throw new IllegalArgumentException("'" + element + "' is not a byte value");
            }
            out.write((int) element.asLong());
        }
        return out.toByteArray();
    }

    /** True when every element of {@code array} is an integer in {@code [0, 255]}. */
    public static boolean isByteList(JsonNode array) {
        for (JsonNode element : array) {
            if (!isByte(element)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isByte(JsonNode element) {
        return element.isIntegralNumber() && element.canConvertToLong()
                && element.asLong() >= 0 && element.asLong() <= 0xFF;
    }

    /** Big-endian bytes of a non-negative integer, using as few bytes as possible (at least one). */
    public static byte[] fromLong(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("negative value " + value + " has no byte representation");
        }
        int length = Math.max(1, (Long.SIZE - Long.numberOfLeadingZeros(value) + 7) / 8);
        byte[] bytes = new byte[length];
        for (int i = length - 1; i >= 0; i--) {
            bytes[i] = (byte) (value & 0xFF);
            value >>>= 8;
        }
        return bytes;
    }

    /** Converts a {@code default:} value of a byte-array property. */
    public static byte[] fromDefault(JsonNode value) {
        if (value.isTextual()) {
            return fromHex(value.asText());
        }
        return fromInts(value);
    }
}
