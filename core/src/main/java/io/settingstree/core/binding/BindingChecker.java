package io.settingstree.core.binding;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.error.SchemaException;
import io.settingstree.core.model.SourceKind;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Structural validation of a merged binding document. */
final class BindingChecker {

    private static final Set<String> PROPERTY_KEYS =
            Set.of("description", "type", "required", "enum", "const", "default", "deprecated");

    private static final Map<String, String> LEGACY_KEYS = new LinkedHashMap<>();
    private static final Map<String, String> HARDWARE_LEGACY_KEYS = new LinkedHashMap<>();

    static {
        LEGACY_KEYS.put("sub-node", "use a property with 'type: node' instead");
        LEGACY_KEYS.put("title", "use 'description' instead");
        HARDWARE_LEGACY_KEYS.put("#cells", "expected *-cells syntax");
        HARDWARE_LEGACY_KEYS.put("child", "use 'bus: <bus>' instead");
        HARDWARE_LEGACY_KEYS.put("child-bus", "use 'bus: <bus>' instead");
        HARDWARE_LEGACY_KEYS.put("parent", "use 'on-bus: <bus>' instead");
        HARDWARE_LEGACY_KEYS.put("parent-bus", "use 'on-bus: <bus>' instead");
    }

    private final SourceKind kind;

    BindingChecker(SourceKind kind) {
        this.kind = kind;
    }

    /** Name of the top-level key holding the schema id of {@code document}. */
    String schemaKey(JsonNode document) {
        if (kind == SourceKind.HARDWARE && !document.has("schema")) {
            return SourceKind.HARDWARE.schemaProperty();
        }
        return "schema";
    }

    void check(JsonNode document, String path, boolean child, boolean requireSchema, boolean requireDescription) {
        Set<String> topLevelKeys = topLevelKeys(document, child);

        for (Iterator<String> it = document.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            String hint = LEGACY_KEYS.get(key);
            if (hint == null && kind == SourceKind.HARDWARE) {
                hint = HARDWARE_LEGACY_KEYS.get(key);
            }
            if (hint != null) {
                throw new SchemaException("legacy '" + key + ":' in " + path + ", " + hint, path);
            }
        }

        rejectUnknownKeys(document, topLevelKeys, path);

        if (kind == SourceKind.HARDWARE) {
            checkHardwareKeys(document, path);
        }

        String schemaKey = schemaKey(document);
        JsonNode schema = document.get(schemaKey);
        if (schema != null && !schema.isNull()) {
            if (!schema.isTextual()) {
                throw new SchemaException(
                        "malformed '" + schemaKey + ": " + IncludeMerger.display(schema) + "' field in " + path
                                + " - should be a string, not " + schema.getNodeType().name().toLowerCase(Locale.ROOT),
                        path);
            }
        } else if (requireSchema) {
            throw new SchemaException("missing '" + schemaKey + "' property in " + path, path);
        }

        JsonNode description = document.get("description");
        if (description != null) {
            if (!description.isTextual() || description.asText().isEmpty()) {
                throw new SchemaException("malformed or empty 'description' in " + path, path);
            }
        } else if (requireDescription) {
            throw new SchemaException("missing 'description' in " + path, path);
        }

        checkProperties(document, path, topLevelKeys);
    }

    private Set<String> topLevelKeys(JsonNode document, boolean child) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(schemaKey(document));
        keys.add("description");
        keys.add("properties");
        if (child) {
            keys.add("type");
        }
        if (kind == SourceKind.HARDWARE) {
            keys.add("bus");
            keys.add("on-bus");
        }
        return keys;
    }

    private void rejectUnknownKeys(JsonNode document, Set<String> knownKeys, String path) {
        List<String> unknown = new ArrayList<>();
        for (Iterator<String> it = document.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (knownKeys.contains(key) || (kind == SourceKind.HARDWARE && key.endsWith("-cells"))) {
                continue;
            }
            unknown.add(key);
        }
        if (!unknown.isEmpty()) {
            String s = unknown.size() > 1 ? "s" : "";
            throw new SchemaException(
                    "Unknown key" + s + " in " + path + ": " + unknown + ", recognized keys are: " + knownKeys
                            + (kind == SourceKind.HARDWARE ? " or *-cells" : ""),
                    path);
        }
    }

    private static void checkHardwareKeys(JsonNode document, String path) {
        JsonNode onBus = document.get("on-bus");
        if (onBus != null && !onBus.isTextual()) {
            throw new SchemaException("malformed 'on-bus:' value in " + path + ", expected string", path);
        }
        JsonNode bus = document.get("bus");
        if (bus != null && !bus.isTextual() && !isStringList(bus)) {
            throw new SchemaException(
                    "malformed 'bus:' value in " + path + ", expected string or list of strings", path);
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = document.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getKey().endsWith("-cells") && !isStringList(entry.getValue())) {
                throw new SchemaException(
                        "malformed '" + entry.getKey() + ":' in " + path + ", expected a list of strings", path);
            }
        }
    }

    // --- properties ---

    private void checkProperties(JsonNode document, String path, Set<String> topLevelKeys) {
        JsonNode properties = document.get("properties");
        if (properties == null || properties.isNull()) {
            return;
        }
        if (!properties.isObject()) {
            throw new SchemaException("malformed 'properties:' in " + path + ", expected a mapping", path);
        }

        Set<String> propertyKeys = new LinkedHashSet<>(PROPERTY_KEYS);
        if (kind == SourceKind.HARDWARE) {
            propertyKeys.add("specifier-space");
        }

        for (Iterator<Map.Entry<String, JsonNode>> it = properties.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            JsonNode spec = entry.getValue();
            if (!spec.isObject()) {
                throw new SchemaException(
                        "malformed 'properties: " + name + ":' in " + path + ", expected a mapping", path);
            }
            boolean childBinding = IncludeMerger.isNodeType(spec);

            for (Iterator<String> keys = spec.fieldNames(); keys.hasNext(); ) {
                String key = keys.next();
                if (childBinding
                        && (topLevelKeys.contains(key)
                                || (kind == SourceKind.HARDWARE && key.endsWith("-cells")))) {
                    // child bindings carry their own top-level keys
                    continue;
                }
                if (!propertyKeys.contains(key)) {
                    throw new SchemaException(
                            "unknown setting '" + key + "' in 'properties: " + name + ": ...' in " + path
                                    + ", expected one of " + String.join(", ", propertyKeys),
                            path);
                }
            }

            checkByType(name, spec, path);

            for (String option : List.of("required", "deprecated")) {
                JsonNode value = spec.get(option);
                if (value != null && !value.isBoolean()) {
                    throw new SchemaException(
                            "malformed '" + option + ":' setting '" + IncludeMerger.display(value) + "' for '" + name
                                    + "' in 'properties' in " + path + ", expected true/false",
                            path);
                }
            }

            if (spec.path("deprecated").asBoolean(false) && spec.path("required").asBoolean(false)) {
                throw new SchemaException(
                        "'" + name + "' in 'properties' in " + path
                                + " should not have both 'deprecated' and 'required' set",
                        path);
            }

            JsonNode description = spec.get("description");
            if (description != null && !description.isTextual()) {
                throw new SchemaException(
                        "missing, malformed, or empty 'description' for '" + name + "' in 'properties' in " + path,
                        path);
            }

            JsonNode enumValues = spec.get("enum");
            if (enumValues != null && !enumValues.isArray()) {
                throw new SchemaException("enum in " + path + " for property '" + name + "' is not a list", path);
            }
        }
    }

    private void checkByType(String name, JsonNode spec, String path) {
        JsonNode typeNode = spec.get("type");
        if (typeNode == null || typeNode.isNull()) {
            throw new SchemaException("missing 'type:' for '" + name + "' in 'properties' in " + path, path);
        }
        PropertyType type = typeNode.isTextual() ? PropertyType.fromTag(typeNode.asText()) : null;
        if (type == PropertyType.NODE) {
            // checked by the child binding itself
            return;
        }
        if (type == null || !type.isAvailableIn(kind)) {
            throw new SchemaException(
                    "'" + name + "' in 'properties:' in " + path + " has unknown type '"
                            + IncludeMerger.display(typeNode) + "', expected one of "
                            + String.join(", ", PropertyType.tagsFor(kind)),
                    path);
        }

        if (kind == SourceKind.HARDWARE) {
            if (spec.has("specifier-space") && type != PropertyType.PHANDLE_ARRAY) {
                throw new SchemaException(
                        "'specifier-space' in 'properties: " + name + "' has type '" + type.tag()
                                + "', expected 'phandle-array'",
                        path);
            }
            if (type == PropertyType.PHANDLE_ARRAY && !name.endsWith("s") && !spec.has("specifier-space")) {
                throw new SchemaException(
                        "'" + name + "' in 'properties:' in " + path + " has type 'phandle-array' and its name does"
                                + " not end in 's', but no 'specifier-space' was provided.",
                        path);
            }
        }

        JsonNode constValue = spec.get("const");
        if (constValue != null && !constValue.isNull() && !type.allowsConst()) {
            throw new SchemaException(
                    "const in " + path + " for property '" + name + "' has type '" + type.tag()
                            + "', expected one of int, array, uint8-array, string, string-array",
                    path);
        }

        JsonNode defaultValue = spec.get("default");
        if (defaultValue == null || defaultValue.isNull()) {
            return;
        }
        if (!type.allowsDefault(kind)) {
            throw new SchemaException(
                    "'default:' can't be combined with 'type: " + type.tag() + "' for '" + name
                            + "' in 'properties:' in " + path,
                    path);
        }
        if (!isValidDefault(type, defaultValue)) {
            throw new SchemaException(
                    "'default: " + IncludeMerger.display(defaultValue) + "' is invalid for '" + name
                            + "' in 'properties:' in " + path + ", which has type " + type.tag(),
                    path);
        }
    }

    static boolean isValidDefault(PropertyType type, JsonNode value) {
        return switch (type.shape()) {
            case BOOLEAN -> value.isBoolean();
            case INT -> isIntInRange(type, value);
            case INT_ARRAY -> value.isArray() && allMatch(value, element -> isIntInRange(type, element));
            case FLOAT -> value.isNumber();
            case FLOAT_ARRAY -> value.isArray() && allMatch(value, JsonNode::isNumber);
            case BYTES -> (value.isTextual() && ByteValues.isHex(value.asText()))
                    || (value.isArray() && ByteValues.isByteList(value));
            case STRING -> value.isTextual();
            case STRING_ARRAY -> value.isArray() && allMatch(value, JsonNode::isTextual);
            default -> false;
        };
    }

    private static boolean isIntInRange(PropertyType type, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            return false;
        }
        long v = value.asLong();
        return v >= type.min() && v <= type.max();
    }

    private static boolean allMatch(JsonNode array, java.util.function.Predicate<JsonNode> predicate) {
        for (JsonNode element : array) {
            if (!predicate.test(element)) {
                return false;
            }
        }
        return true;
    }

    static boolean isStringList(JsonNode value) {
        return value.isArray() && allMatch(value, JsonNode::isTextual);
    }
}
