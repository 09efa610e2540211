package io.settingstree.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a decoded source tree, before any binding is applied.
 *
 * @param path        absolute path, {@code /} for the root
 * @param name        last path segment, empty for the root
 * @param parentPath  path of the parent, or null for the root
 * @param childNames  names of the children in source order
 * @param properties  raw property values in source order
 * @param labels      labels attached to the node
 */
public record RawNode(
        String path, String name, String parentPath, List<String> childNames, Map<String, JsonNode> properties,
        List<String> labels) {

    public RawNode {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(name, "name must not be null");
        childNames = List.copyOf(Objects.requireNonNull(childNames, "childNames must not be null"));
        properties = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(properties, "properties must not be null")));
        labels = List.copyOf(Objects.requireNonNull(labels, "labels must not be null"));
    }

    /** Returns the raw value of {@code property}, or null if the node does not set it. */
    public JsonNode property(String property) {
        return properties.get(property);
    }

    public boolean isRoot() {
        return parentPath == null;
    }

    /** Path of the child named {@code childName}. */
    public String childPath(String childName) {
        return "/".equals(path) ? "/" + childName : path + "/" + childName;
    }
}
