package io.settingstree.core.binding;

import io.settingstree.core.model.SourceKind;
import java.util.ArrayList;
import java.util.List;

/**
 * The closed set of property types a binding may declare, with the source kinds that accept each
 * type and the rules for {@code default:} and {@code const:}.
 */
public enum PropertyType {
    BOOLEAN("boolean", ValueShape.BOOLEAN, Scope.BOTH, Scope.CONFIG),
    INT("int", ValueShape.INT, Scope.BOTH, Scope.BOTH),
    ARRAY("array", ValueShape.INT_ARRAY, Scope.BOTH, Scope.BOTH),
    UINT8_ARRAY("uint8-array", ValueShape.BYTES, Scope.BOTH, Scope.BOTH),
    STRING("string", ValueShape.STRING, Scope.BOTH, Scope.BOTH),
    STRING_ARRAY("string-array", ValueShape.STRING_ARRAY, Scope.BOTH, Scope.BOTH),
    NODE("node", ValueShape.NODE, Scope.BOTH, Scope.NONE),

    // hardware description only
    PHANDLE("phandle", ValueShape.REFERENCE, Scope.HARDWARE, Scope.NONE),
    PHANDLES("phandles", ValueShape.REFERENCE_ARRAY, Scope.HARDWARE, Scope.NONE),
    PHANDLE_ARRAY("phandle-array", ValueShape.SPECIFIER_ARRAY, Scope.HARDWARE, Scope.NONE),
    PATH("path", ValueShape.PATH, Scope.HARDWARE, Scope.NONE),
    COMPOUND("compound", ValueShape.OPAQUE, Scope.HARDWARE, Scope.NONE),

    // configuration only
    POINTER("pointer", ValueShape.REFERENCE, Scope.CONFIG, Scope.NONE),
    POINTER_ARRAY("pointer-array", ValueShape.REFERENCE_ARRAY, Scope.CONFIG, Scope.NONE),
    FLOAT("float", ValueShape.FLOAT, Scope.CONFIG, Scope.CONFIG),
    FLOAT_ARRAY("float-array", ValueShape.FLOAT_ARRAY, Scope.CONFIG, Scope.CONFIG),
    DOUBLE("double", ValueShape.FLOAT, Scope.CONFIG, Scope.CONFIG),
    DOUBLE_ARRAY("double-array", ValueShape.FLOAT_ARRAY, Scope.CONFIG, Scope.CONFIG),
    INT8("int8", ValueShape.INT, Byte.MIN_VALUE, Byte.MAX_VALUE),
    INT8_ARRAY("int8-array", ValueShape.INT_ARRAY, Byte.MIN_VALUE, Byte.MAX_VALUE),
    INT16("int16", ValueShape.INT, Short.MIN_VALUE, Short.MAX_VALUE),
    INT16_ARRAY("int16-array", ValueShape.INT_ARRAY, Short.MIN_VALUE, Short.MAX_VALUE),
    INT32("int32", ValueShape.INT, Integer.MIN_VALUE, Integer.MAX_VALUE),
    INT32_ARRAY("int32-array", ValueShape.INT_ARRAY, Integer.MIN_VALUE, Integer.MAX_VALUE),
    INT64("int64", ValueShape.INT, Long.MIN_VALUE, Long.MAX_VALUE),
    INT64_ARRAY("int64-array", ValueShape.INT_ARRAY, Long.MIN_VALUE, Long.MAX_VALUE),
    UINT8("uint8", ValueShape.INT, 0, 0xFFL),
    UINT16("uint16", ValueShape.INT, 0, 0xFFFFL),
    UINT16_ARRAY("uint16-array", ValueShape.INT_ARRAY, 0, 0xFFFFL),
    UINT32("uint32", ValueShape.INT, 0, 0xFFFF_FFFFL),
    UINT32_ARRAY("uint32-array", ValueShape.INT_ARRAY, 0, 0xFFFF_FFFFL),
    // values above Long.MAX_VALUE are not representable
    UINT64("uint64", ValueShape.INT, 0, Long.MAX_VALUE),
    UINT64_ARRAY("uint64-array", ValueShape.INT_ARRAY, 0, Long.MAX_VALUE);

    /** How a type's value is represented once resolved. */
    public enum ValueShape {
        BOOLEAN,
        INT,
        INT_ARRAY,
        BYTES,
        STRING,
        STRING_ARRAY,
        FLOAT,
        FLOAT_ARRAY,
        REFERENCE,
        REFERENCE_ARRAY,
        SPECIFIER_ARRAY,
        PATH,
        OPAQUE,
        NODE;

        /** True for shapes whose value is a list. */
        public boolean isArray() {
            return this == INT_ARRAY
                    || this == STRING_ARRAY
                    || this == FLOAT_ARRAY
                    || this == REFERENCE_ARRAY
                    || this == SPECIFIER_ARRAY;
        }
    }

    private enum Scope {
        BOTH,
        HARDWARE,
        CONFIG,
        NONE;

        boolean includes(SourceKind kind) {
            return switch (this) {
                case BOTH -> true;
                case HARDWARE -> kind == SourceKind.HARDWARE;
                case CONFIG -> kind == SourceKind.CONFIG;
                case NONE -> false;
            };
        }
    }

    private final String tag;
    private final ValueShape shape;
    private final Scope availableIn;
    private final Scope defaultIn;
    private final long min;
    private final long max;

    PropertyType(String tag, ValueShape shape, Scope availableIn, Scope defaultIn) {
        this(tag, shape, availableIn, defaultIn, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    PropertyType(String tag, ValueShape shape, long min, long max) {
        this(tag, shape, Scope.CONFIG, Scope.CONFIG, min, max);
    }

    PropertyType(String tag, ValueShape shape, Scope availableIn, Scope defaultIn, long min, long max) {
        this.tag = tag;
        this.shape = shape;
        this.availableIn = availableIn;
        this.defaultIn = defaultIn;
        this.min = min;
        this.max = max;
    }

    /** The name used after {@code type:} in binding documents. */
    public String tag() {
        return tag;
    }

    public ValueShape shape() {
        return shape;
    }

    /** Smallest legal value for integer types. */
    public long min() {
        return min;
    }

    /** Largest legal value for integer types. */
    public long max() {
        return max;
    }

    /** True when this type is a fixed-width integer whose values must be range checked. */
    public boolean isSized() {
        return min != Long.MIN_VALUE || max != Long.MAX_VALUE || this == INT64 || this == INT64_ARRAY;
    }

    public boolean isAvailableIn(SourceKind kind) {
        return availableIn.includes(kind);
    }

    /** Whether properties of this type may declare a {@code default:} in the given source kind. */
    public boolean allowsDefault(SourceKind kind) {
        return defaultIn.includes(kind);
    }

    /** Whether properties of this type may declare a {@code const:}. */
    public boolean allowsConst() {
        return this == INT || this == ARRAY || this == UINT8_ARRAY || this == STRING || this == STRING_ARRAY;
    }

    /**
     * Looks up a type by its tag.
     *
     * @return the type, or null if the tag is unknown
     */
    public static PropertyType fromTag(String tag) {
        for (PropertyType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return null;
    }

    /** Tags of every type available in the given source kind, in declaration order. */
    public static List<String> tagsFor(SourceKind kind) {
        List<String> tags = new ArrayList<>();
        for (PropertyType type : values()) {
            if (type.isAvailableIn(kind)) {
                tags.add(type.tag);
            }
        }
        return tags;
    }
}
