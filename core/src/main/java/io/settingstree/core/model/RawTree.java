package io.settingstree.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded source tree: every raw node keyed by path, in parent-before-child insertion order.
 *
 * <p>
 * Thread-safe: immutable once built.
 */
public final class RawTree {

    private final String source;
    private final Map<String, RawNode> nodes;

    private RawTree(String source, Map<String, RawNode> nodes) {
        this.source = source;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    /**
     * Returns a new builder for a tree read from {@code source}.
     *
     * @param source file name or other description of where the tree came from
     */
    public static Builder builder(String source) {
        return new Builder(source);
    }

    /** Where the tree came from, used in diagnostics. */
    public String source() {
        return source;
    }

    public RawNode root() {
        return nodes.get("/");
    }

    /** Returns the node at {@code path}, or null if there is none. */
    public RawNode node(String path) {
        return nodes.get(path);
    }

    public Collection<RawNode> nodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    /** Builder for {@link RawTree}. Missing ancestors are created empty. */
    public static final class Builder {

        private final String source;
        private final Map<String, MutableNode> nodes = new LinkedHashMap<>();

        Builder(String source) {
            this.source = Objects.requireNonNull(source, "source must not be null");
            nodes.put("/", new MutableNode("/", "", null));
        }

        /** Adds (or extends) the node at {@code path}. */
        public Builder node(String path, List<String> labels, Map<String, JsonNode> properties) {
            MutableNode node = ensure(normalize(path));
            for (String label : labels) {
                if (!node.labels.contains(label)) {
                    node.labels.add(label);
                }
            }
            node.properties.putAll(properties);
            return this;
        }

        public Builder node(String path, Map<String, JsonNode> properties) {
            return node(path, List.of(), properties);
        }

        /** Sets one property on the node at {@code path}, creating the node if needed. */
        public Builder property(String path, String name, JsonNode value) {
            ensure(normalize(path)).properties.put(name, value);
            return this;
        }

        public RawTree build() {
            Map<String, RawNode> built = new LinkedHashMap<>();
            for (MutableNode node : nodes.values()) {
                built.put(
                        node.path,
                        new RawNode(node.path, node.name, node.parentPath, node.children, node.properties, node.labels));
            }
            return new RawTree(source, built);
        }

        private MutableNode ensure(String path) {
            MutableNode existing = nodes.get(path);
            if (existing != null) {
                return existing;
            }
            int slash = path.lastIndexOf('/');
            String parentPath = slash == 0 ? "/" : path.substring(0, slash);
            String name = path.substring(slash + 1);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty node name in path '" + path + "'");
            }
            MutableNode parent = ensure(parentPath);
            MutableNode node = new MutableNode(path, name, parentPath);
            parent.children.add(name);
            nodes.put(path, node);
            return node;
        }

        private static String normalize(String path) {
            if (!path.startsWith("/")) {
                throw new IllegalArgumentException("Node path must be absolute: '" + path + "'");
            }
            if (path.length() > 1 && path.endsWith("/")) {
                return path.substring(0, path.length() - 1);
            }
            return path;
        }
    }

    private static final class MutableNode {
        private final String path;
        private final String name;
        private final String parentPath;
        private final List<String> children = new ArrayList<>();
        private final Map<String, JsonNode> properties = new LinkedHashMap<>();
        private final List<String> labels = new ArrayList<>();

        MutableNode(String path, String name, String parentPath) {
            this.path = path;
            this.name = name;
            this.parentPath = parentPath;
        }
    }
}
