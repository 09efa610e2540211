package io.settingstree.core.binding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.settingstree.core.error.SchemaException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Document-level operations behind {@code include:}: child-binding normalization, property
 * filtering, and the recursive merge of an included document into its includer.
 */
final class IncludeMerger {

    static final String CHILD_BINDING_PATTERN = ".*";

    private final Set<String> overridableKeys;

    IncludeMerger(Set<String> overridableKeys) {
        this.overridableKeys = Set.copyOf(overridableKeys);
    }

    // --- child-binding normalization ---

    /** Rewrites every {@code child-binding:} into a {@code .*} property of type node, recursively. */
    static void normalizeChildBinding(ObjectNode document, String path) {
        JsonNode childBinding = document.get("child-binding");
        if (childBinding == null) {
            return;
        }
        if (!childBinding.isObject()) {
            throw new SchemaException(
                    "malformed 'child-binding:' in " + path + ", expected a binding (dictionary with keys/values)",
                    path);
        }
        document.remove("child-binding");
        ObjectNode child = (ObjectNode) childBinding;
        normalizeChildBinding(child, path);
        child.put("type", "node");
        JsonNode properties = document.get("properties");
        if (properties == null || properties.isNull()) {
            properties = document.putObject("properties");
        } else if (!properties.isObject()) {
            throw new SchemaException("malformed 'properties:' in " + path + ", expected a mapping", path);
        }
        ((ObjectNode) properties).set(CHILD_BINDING_PATTERN, child);
    }

    // --- filtering ---

    /**
     * Applies an allowlist or blocklist to {@code properties} in place, then the child filter to every
     * property of type node.
     */
    static void filterProperties(
            String path, JsonNode properties, List<String> allowlist, List<String> blocklist, IncludeFilter child) {
        if (properties == null || !properties.isObject() || properties.isEmpty()) {
            return;
        }
        ObjectNode props = (ObjectNode) properties;
        Map<String, JsonNode> toAdd = new LinkedHashMap<>();
        List<String> toDelete = new ArrayList<>();

        if (allowlist != null) {
            for (Iterator<Map.Entry<String, JsonNode>> it = props.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String name = entry.getKey();
                if (isNodeType(entry.getValue()) || allowlist.contains(name)) {
                    continue;
                }
                toDelete.add(name);
                Pattern pattern = compile(name, path);
                for (String allowKey : allowlist) {
                    if (pattern.matcher(allowKey).matches() && !props.has(allowKey)) {
                        // a pattern covering an allowed name becomes an exact entry
                        toAdd.put(allowKey, entry.getValue());
                    }
                }
            }
        } else if (blocklist != null) {
            for (Iterator<Map.Entry<String, JsonNode>> it = props.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String name = entry.getKey();
                if (isNodeType(entry.getValue())) {
                    continue;
                }
                if (blocklist.contains(name)) {
                    toDelete.add(name);
                    continue;
                }
                Pattern pattern = compile(name, path);
                String restricted = name;
                for (String blockKey : blocklist) {
                    if (pattern.matcher(blockKey).matches()) {
                        toDelete.add(name);
                        restricted = "(?!^" + blockKey + "$)" + restricted;
                    }
                }
                if (!props.has(restricted)) {
                    toAdd.put(restricted, entry.getValue());
                }
            }
        }

        toDelete.forEach(props::remove);
        toAdd.forEach(props::set);

        if (child == null || child.isEmpty()) {
            return;
        }
        for (JsonNode spec : props) {
            if (isNodeType(spec)) {
                filterProperties(path, spec.get("properties"), child.allowlist(), child.blocklist(), child.child());
            }
        }
    }

    // --- merging ---

    /**
     * Recursively merges {@code from} into {@code to}. Values already in {@code to} win; a differing
     * value is an error unless the key is overridable. {@code required} values are OR-ed, and with
     * {@code checkRequired} an includer may not relax {@code required: true}.
     */
    void merge(String path, ObjectNode to, ObjectNode from, boolean checkRequired, String parentKey) {
        for (Iterator<Map.Entry<String, JsonNode>> it = from.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            JsonNode fromValue = entry.getValue();
            JsonNode toValue = to.get(key);

            if (toValue != null && toValue.isObject() && fromValue.isObject()) {
                merge(path, (ObjectNode) toValue, (ObjectNode) fromValue, checkRequired, key);
            } else if (toValue == null) {
                to.set(key, fromValue.deepCopy());
            } else if (isBadOverwrite(key, toValue, fromValue, checkRequired)) {
                throw new SchemaException(
                        path + " (in '" + parentKey + "'): '" + key + "' from included file overwritten ('"
                                + display(fromValue) + "' replaced with '" + display(toValue) + "')",
                        path);
            } else if ("required".equals(key)) {
                if (!fromValue.isBoolean() || !toValue.isBoolean()) {
                    throw new SchemaException(
                            "malformed 'required:' setting for '" + parentKey + "' in 'properties' in " + path
                                    + ", expected true/false",
                            path);
                }
                to.put("required", toValue.asBoolean() || fromValue.asBoolean());
            }
        }
    }

    private boolean isBadOverwrite(String key, JsonNode toValue, JsonNode fromValue, boolean checkRequired) {
        if (toValue.equals(fromValue)) {
            return false;
        }
        if (overridableKeys.contains(key)) {
            return false;
        }
        if ("required".equals(key)) {
            return checkRequired && fromValue.asBoolean() && !toValue.asBoolean();
        }
        return true;
    }

    // --- helpers ---

    static boolean isNodeType(JsonNode spec) {
        return spec != null && spec.isObject() && "node".equals(spec.path("type").asText(null));
    }

    static Pattern compile(String name, String path) {
        try {
            return Pattern.compile(name);
        } catch (PatternSyntaxException e) {
            throw new SchemaException("invalid property name pattern '" + name + "' in " + path, e, path);
        }
    }

    static String display(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
