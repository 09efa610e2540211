package io.settingstree.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.settingstree.core.error.SourceException;
import io.settingstree.core.model.RawTree;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a configuration source: a YAML list of overlays, each mapping mount points to nodes.
 *
 * <pre>{@code
 * - /:
 *     app:
 *       schema: vnd,app
 * - app:                 # mounted on the node named "app"
 *     http:
 *       port: 8080
 * - x-defaults: &defaults  # ignored, reusable snippet
 *     retries: 3
 * }</pre>
 *
 * <p>
 * Overlays are applied in order: nested mappings merge, every other value replaces what was there.
 * A mount point is an absolute path, created as needed, or the name of exactly one existing node.
 * Mount points starting with {@code x-} are skipped. Every node is labelled with its own name.
 */
public final class ConfigOverlayReader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigOverlayReader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigOverlayReader() {
        // utility class
    }

    /**
     * Reads the configuration file at {@code path}.
     *
     * @throws SourceException if the file cannot be read, is malformed, or a mount point is not found
     */
    public static RawTree read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceException("Failed to read configuration: " + e.getMessage(), e, path.toString());
        }
        return read(text, path.toString());
    }

    /**
     * Reads a configuration from YAML text.
     *
     * @param yaml   the overlay list
     * @param source name reported in errors and by {@link RawTree#source()}
     */
    public static RawTree read(String yaml, String source) {
        ObjectNode merged = merge(parse(yaml, source), source);
        RawTree.Builder builder = RawTree.builder(source);
        addNode(builder, "/", null, merged);
        RawTree tree = builder.build();
        LOG.info("Configuration read: source={}, nodes={}", source, tree.size());
        return tree;
    }

    /** Applies the overlays in {@code yaml} and returns the resulting document, root first. */
    public static ObjectNode mergedDocument(String yaml, String source) {
        return merge(parse(yaml, source), source);
    }

    private static JsonNode parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new SourceException("Invalid YAML in configuration: " + e.getOriginalMessage(), e, source);
        }
        if (root == null || !root.isArray()) {
            throw new SourceException("Expected a list of configuration overlays in " + source, source);
        }
        return root;
    }

    // --- overlays ---

    private static ObjectNode merge(JsonNode overlays, String source) {
        ObjectNode document = YAML_MAPPER.createObjectNode();
        for (JsonNode overlay : overlays) {
            if (!overlay.isObject()) {
                throw new SourceException(
                        "Overlay " + overlay + " should be a dictionary of mount points to configuration nodes.",
                        source);
            }
            for (Iterator<Map.Entry<String, JsonNode>> it = overlay.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String mountPoint = entry.getKey();
                if (mountPoint.startsWith("x-")) {
                    continue;
                }
                if (!entry.getValue().isObject()) {
                    throw new SourceException(
                            "Overlay for mount point " + mountPoint + " should be a dictionary of configuration"
                                    + " nodes, not " + entry.getValue(),
                            source);
                }
                ObjectNode target = mountTarget(document, mountPoint, source);
                LOG.debug("Applying overlay: source={}, mountPoint={}", source, mountPoint);
                deepMerge(target, (ObjectNode) entry.getValue());
            }
        }
        return document;
    }

    private static ObjectNode mountTarget(ObjectNode document, String mountPoint, String source) {
        if (mountPoint.startsWith("/")) {
            ObjectNode target = document;
            for (String part : mountPoint.substring(1).split("/")) {
                if (part.isEmpty()) {
                    continue;
                }
                JsonNode existing = target.get(part);
                target = existing != null && existing.isObject() ? (ObjectNode) existing : target.putObject(part);
            }
            return target;
        }
        if (mountPoint.contains("/")) {
            throw new SourceException(
                    "Mount point " + mountPoint + " should either be an absolute path (ie. start with '/') or a"
                            + " label not containing any slashes.",
                    source);
        }
        List<ObjectNode> found = new ArrayList<>();
        findNamed(document, mountPoint, found);
        if (found.isEmpty()) {
            throw new SourceException(
                    "Target label " + mountPoint + " for overlay not found in configuration.", source);
        }
        if (found.size() > 1) {
            throw new SourceException(
                    "The label " + mountPoint + " is not unique in the configuration (" + found.size()
                            + " nodes).",
                    source);
        }
        return found.get(0);
    }

    private static void findNamed(ObjectNode node, String name, List<ObjectNode> found) {
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isObject()) {
                if (entry.getKey().equals(name)) {
                    found.add((ObjectNode) entry.getValue());
                }
                findNamed((ObjectNode) entry.getValue(), name, found);
            }
        }
    }

    private static void deepMerge(ObjectNode target, ObjectNode overlay) {
        for (Iterator<Map.Entry<String, JsonNode>> it = overlay.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode existing = target.get(entry.getKey());
            if (existing != null && existing.isObject() && entry.getValue().isObject()) {
                deepMerge((ObjectNode) existing, (ObjectNode) entry.getValue());
            } else {
                target.set(entry.getKey(), entry.getValue().deepCopy());
            }
        }
    }

    // --- raw tree ---

    private static void addNode(RawTree.Builder builder, String path, String name, JsonNode node) {
        Map<String, JsonNode> properties = new LinkedHashMap<>();
        List<Map.Entry<String, JsonNode>> children = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isObject()) {
                children.add(entry);
            } else {
                properties.put(entry.getKey(), entry.getValue());
            }
        }
        builder.node(path, name == null ? List.of() : List.of(name), properties);
        for (Map.Entry<String, JsonNode> child : children) {
            String childPath = "/".equals(path) ? "/" + child.getKey() : path + "/" + child.getKey();
            addNode(builder, childPath, child.getKey(), child.getValue());
        }
    }
}
