package io.settingstree.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Reads a decoded hardware description tree from YAML into a {@link RawTree}.
 *
 * <p>
 * The document is the root node. Mapping values are child nodes, every other value is a property.
 * A child key may carry labels in front of the node name:
 *
 * <pre>{@code
 * soc:
 *   "gpio0: gpio@50000000":
 *     compatible: vnd,gpio
 *     reg: [0x50000000, 0x1000]
 *     gpio-controller: true
 *     "#gpio-cells": 2
 * }</pre>
 *
 * <p>
 * References are written {@code &label} or {@code /path}; {@code true} or an empty value marks a
 * boolean or empty property.
 */
public final class HardwareTreeReader {

    private static final Logger LOG = LoggerFactory.getLogger(HardwareTreeReader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private HardwareTreeReader() {
        // utility class
    }

    /**
     * Reads the hardware tree file at {@code path}.
     *
     * @throws SourceException if the file cannot be read or is not a mapping
     */
    public static RawTree read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceException("Failed to read hardware tree: " + e.getMessage(), e, path.toString());
        }
        return read(text, path.toString());
    }

    /**
     * Reads a hardware tree from YAML text.
     *
     * @param yaml   the document
     * @param source name reported in errors and by {@link RawTree#source()}
     */
    public static RawTree read(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new SourceException("Invalid YAML in hardware tree: " + e.getOriginalMessage(), e, source);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new SourceException("Expected a mapping as the root node of hardware tree " + source, source);
        }

        RawTree.Builder builder = RawTree.builder(source);
        addNode(builder, "/", List.of(), root, source);
        RawTree tree = builder.build();
        LOG.info("Hardware tree read: source={}, nodes={}", source, tree.size());
        return tree;
    }

    private static void addNode(RawTree.Builder builder, String path, List<String> labels, JsonNode node, String source) {
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
        builder.node(path, labels, properties);

        for (Map.Entry<String, JsonNode> child : children) {
            String[] parts = child.getKey().split(":");
            String name = parts[parts.length - 1].trim();
            List<String> childLabels = new ArrayList<>();
            for (int i = 0; i < parts.length - 1; i++) {
                String label = parts[i].trim();
                if (label.isEmpty()) {
                    throw new SourceException(
                            "Empty label in node key '" + child.getKey() + "' under " + path, source);
                }
                childLabels.add(label);
            }
            if (name.isEmpty() || name.contains("/")) {
                throw new SourceException("Invalid node name '" + child.getKey() + "' under " + path, source);
            }
            String childPath = "/".equals(path) ? "/" + name : path + "/" + name;
            addNode(builder, childPath, childLabels, child.getValue(), source);
        }
    }
}
