package io.settingstree.core.binding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.SchemaException;
import io.settingstree.core.model.SourceKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses binding documents into {@link Binding} objects.
 *
 * <p>
 * Parsing flow:
 * <ol>
 * <li>Read the YAML document and rewrite {@code child-binding:} as a {@code .*} node property</li>
 * <li>Apply the caller's property filter, if any</li>
 * <li>Resolve {@code include:} depth first: every included document is loaded, filtered,
 * resolved recursively, and merged into an accumulator; the accumulator is then merged into the
 * including document, whose own values take precedence</li>
 * <li>Validate the merged document and build property specs and child bindings</li>
 * </ol>
 */
public final class BindingParser {

    private static final Logger LOG = LoggerFactory.getLogger(BindingParser.class);

    static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> INCLUDE_KEYS =
            Set.of("name", "property-allowlist", "property-blocklist", "child-binding");

    private final SourceKind kind;
    private final IncludeResolver includeResolver;
    private final boolean requireSchema;
    private final boolean requireDescription;
    private final IncludeMerger merger;
    private final BindingChecker checker;

    /**
     * Creates a parser.
     *
     * @param kind            source kind whose rules apply
     * @param includeResolver resolves the names used in {@code include:}
     * @param options         tree options (schema/description requirements, overridable keys)
     */
    public BindingParser(SourceKind kind, IncludeResolver includeResolver, TreeOptions options) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.includeResolver = Objects.requireNonNull(includeResolver, "includeResolver must not be null");
        this.requireSchema = options.requireSchema();
        this.requireDescription = options.requireDescription();
        Set<String> overridable = new HashSet<>(options.overridableKeys());
        if (kind == SourceKind.HARDWARE) {
            overridable.add(SourceKind.HARDWARE.schemaProperty());
        }
        this.merger = new IncludeMerger(overridable);
        this.checker = new BindingChecker(kind);
    }

    public BindingParser(SourceKind kind, IncludeResolver includeResolver) {
        this(kind, includeResolver, TreeOptions.defaults());
    }

    public SourceKind kind() {
        return kind;
    }

    /**
     * Parses the binding file at {@code file}.
     *
     * @throws SchemaException if the file cannot be read or the binding is invalid
     */
    public Binding parse(Path file) {
        return resolve(readText(file), file.toString(), IncludeFilter.none());
    }

    /** Resolves a binding from its source text, without any property filter. */
    public Binding resolve(String sourceText, String origin) {
        return resolve(sourceText, origin, IncludeFilter.none());
    }

    /**
     * Resolves a binding from its source text, as if it were included with {@code filter}.
     *
     * @param sourceText YAML text of the binding document
     * @param origin     file path or other identifier used in messages and property origins
     * @param filter     property filter applied to the document and its child bindings
     * @return the resolved binding
     * @throws SchemaException if the document or one of its includes is invalid
     */
    public Binding resolve(String sourceText, String origin, IncludeFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return resolveDocument(readDocument(sourceText, origin), origin, filter, requireSchema);
    }

    /**
     * Resolves a binding synthesized in memory, such as one inferred from the properties of a node.
     * No schema id is required.
     */
    public Binding resolveSynthesized(ObjectNode document, String origin) {
        return resolveDocument(document.deepCopy(), origin, IncludeFilter.none(), false);
    }

    private Binding resolveDocument(ObjectNode document, String origin, IncludeFilter filter, boolean schemaRequired) {
        if (filter.allowlist() != null && filter.blocklist() != null) {
            throw new SchemaException(
                    "binding " + origin + " should not be filtered with both 'property-allowlist:' and"
                            + " 'property-blocklist:'",
                    origin);
        }
        IncludeMerger.normalizeChildBinding(document, origin);
        IncludeMerger.filterProperties(
                origin, document.get("properties"), filter.allowlist(), filter.blocklist(), filter.child());
        Map<String, String> origins =
                mergeIncludes(document, origin, filter.allowlist(), filter.blocklist(), new ArrayDeque<>());
        Binding binding = build(document, origin, origins, false, schemaRequired, requireDescription);
        LOG.debug("Binding resolved: origin={}, schema={}, properties={}",
                origin, binding.schema(), binding.propertySpecs().size());
        return binding;
    }

    // --- include resolution ---

    /**
     * Merges the includes of {@code document} into it, in place. Returns, for every top-level
     * property, the file that last modified it.
     */
    private Map<String, String> mergeIncludes(
            ObjectNode document,
            String path,
            List<String> allowlist,
            List<String> blocklist,
            Deque<String> includeStack) {
        List<String> ownProperties = new ArrayList<>();
        document.path("properties").fieldNames().forEachRemaining(ownProperties::add);

        expandChildIncludes(document, path, allowlist, blocklist, includeStack);

        Map<String, String> origins = new LinkedHashMap<>();
        JsonNode includes = document.remove("include");
        if (includes != null && !includes.isNull()) {
            if (!includes.isTextual() && !includes.isArray()) {
                throw new SchemaException(
                        "'include:' in " + path + " should be a string or list, but has type "
                                + includes.getNodeType(),
                        path);
            }
            ObjectNode merged = YAML_MAPPER.createObjectNode();
            List<JsonNode> elements = new ArrayList<>();
            if (includes.isTextual()) {
                elements.add(includes);
            } else {
                includes.forEach(elements::add);
            }

            for (JsonNode element : elements) {
                String name;
                List<String> mergedAllowlist = allowlist;
                List<String> mergedBlocklist = blocklist;
                IncludeFilter childFilter = null;

                if (element.isTextual()) {
                    name = element.asText();
                } else if (element.isObject()) {
                    ObjectNode include = element.deepCopy();
                    JsonNode nameNode = include.remove("name");
                    name = nameNode == null || nameNode.isNull() ? null : nameNode.asText();
                    mergedAllowlist = mergeList(include, "property-allowlist", allowlist, path);
                    mergedBlocklist = mergeList(include, "property-blocklist", blocklist, path);
                    JsonNode childBinding = include.remove("child-binding");
                    if (!include.isEmpty()) {
                        throw new SchemaException(
                                "'include:' in " + path + " should not have these unexpected contents: " + include
                                        + ", recognized keys are: " + INCLUDE_KEYS,
                                path);
                    }
                    childFilter = checkIncludeDict(name, mergedAllowlist, mergedBlocklist, childBinding, path);
                } else {
                    throw new SchemaException(
                            "all elements in 'include:' in " + path + " should be either strings or maps with a"
                                    + " 'name' key and optional 'property-allowlist' or 'property-blocklist'"
                                    + " keys, but got: " + element,
                            path);
                }

                Path includePath = includeResolver.resolve(name);
                if (includePath == null) {
                    throw new SchemaException("'" + name + "' included from " + path + " not found", path);
                }
                String includeOrigin = includePath.toString();
                if (includeStack.contains(includeOrigin)) {
                    throw new SchemaException(
                            "include cycle in " + path + ": " + includeStack + " includes '" + name + "' again", path);
                }

                ObjectNode included = readDocument(readText(includePath), includeOrigin);
                IncludeMerger.normalizeChildBinding(included, includeOrigin);
                IncludeMerger.filterProperties(
                        path, included.get("properties"), mergedAllowlist, mergedBlocklist, childFilter);

                includeStack.push(includeOrigin);
                Map<String, String> includedOrigins =
                        mergeIncludes(included, includeOrigin, mergedAllowlist, mergedBlocklist, includeStack);
                includeStack.pop();

                merger.merge(path, merged, included, false, null);
                origins.putAll(includedOrigins);
            }

            merger.merge(path, document, merged, true, null);
        }

        // the document's own declarations override what includes declared
        for (String name : ownProperties) {
            origins.put(name, path);
        }
        return origins;
    }

    /** Resolves {@code include:} inside the child bindings declared by {@code document} itself. */
    private void expandChildIncludes(
            ObjectNode document,
            String path,
            List<String> allowlist,
            List<String> blocklist,
            Deque<String> includeStack) {
        JsonNode properties = document.get("properties");
        if (properties == null || !properties.isObject()) {
            return;
        }
        for (JsonNode spec : properties) {
            if (IncludeMerger.isNodeType(spec) && spec.has("include")) {
                mergeIncludes((ObjectNode) spec, path, allowlist, blocklist, includeStack);
            }
        }
    }

    private static List<String> mergeList(
            ObjectNode include, String key, List<String> previous, String path) {
        JsonNode additional = include.remove(key);
        if (additional == null || additional.isNull()) {
            return previous;
        }
        if (!additional.isArray()) {
            throw new SchemaException(
                    "'" + key + "' value " + IncludeMerger.display(additional) + " in " + path
                            + " should be a list",
                    path);
        }
        List<String> merged = new ArrayList<>();
        additional.forEach(element -> merged.add(element.asText()));
        if (previous != null) {
            merged.addAll(previous);
        }
        return merged;
    }

    /**
     * Validates one map-form include element and returns the parsed child filter chain. Runs before
     * the include is loaded.
     */
    private static IncludeFilter checkIncludeDict(
            String name, List<String> allowlist, List<String> blocklist, JsonNode childBinding, String path) {
        if (name == null) {
            throw new SchemaException("'include:' element in " + path + " should have a 'name' key", path);
        }
        if (allowlist != null && blocklist != null) {
            throw new SchemaException(
                    "'include:' of file '" + name + "' in " + path
                            + " should not specify both 'property-allowlist:' and 'property-blocklist:'",
                    path);
        }
        return parseChildFilter(name, childBinding, path);
    }

    private static IncludeFilter parseChildFilter(String name, JsonNode childBinding, String path) {
        if (childBinding == null || childBinding.isNull()) {
            return null;
        }
        if (!childBinding.isObject()) {
            throw new SchemaException(
                    "'include:' of file '" + name + "' in " + path + " has a malformed 'child-binding:' filter",
                    path);
        }
        ObjectNode filter = childBinding.deepCopy();
        List<String> allowlist = filterList(filter.remove("property-allowlist"), "property-allowlist", path);
        List<String> blocklist = filterList(filter.remove("property-blocklist"), "property-blocklist", path);
        JsonNode next = filter.remove("child-binding");
        if (!filter.isEmpty()) {
            throw new SchemaException(
                    "'include:' of file '" + name + "' in " + path
                            + " should not have these unexpected contents in a 'child-binding': " + filter,
                    path);
        }
        if (allowlist != null && blocklist != null) {
            throw new SchemaException(
                    "'include:' of file '" + name + "' in " + path + " should not specify both"
                            + " 'property-allowlist:' and 'property-blocklist:' in a 'child-binding:'",
                    path);
        }
        return new IncludeFilter(allowlist, blocklist, parseChildFilter(name, next, path));
    }

    private static List<String> filterList(JsonNode value, String key, String path) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new SchemaException(
                    "'" + key + "' value " + IncludeMerger.display(value) + " in " + path + " should be a list",
                    path);
        }
        List<String> names = new ArrayList<>();
        value.forEach(element -> names.add(element.asText()));
        return names;
    }

    // --- building ---

    private Binding build(
            ObjectNode document,
            String origin,
            Map<String, String> origins,
            boolean child,
            boolean schemaRequired,
            boolean descriptionRequired) {
        checker.check(document, origin, child, schemaRequired, descriptionRequired);

        String schemaKey = checker.schemaKey(document);
        String schema = document.hasNonNull(schemaKey) ? document.get(schemaKey).asText() : null;
        String description = document.hasNonNull("description") ? document.get("description").asText() : null;

        String variant = null;
        List<String> buses = new ArrayList<>();
        Map<String, List<String>> specifierCells = new LinkedHashMap<>();
        if (kind == SourceKind.HARDWARE) {
            variant = document.hasNonNull("on-bus") ? document.get("on-bus").asText() : null;
            JsonNode bus = document.get("bus");
            if (bus != null && bus.isTextual()) {
                buses.add(bus.asText());
            } else if (bus != null) {
                bus.forEach(element -> buses.add(element.asText()));
            }
            for (Iterator<Map.Entry<String, JsonNode>> it = document.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (key.endsWith("-cells")) {
                    List<String> cells = new ArrayList<>();
                    entry.getValue().forEach(element -> cells.add(element.asText()));
                    specifierCells.put(key.substring(0, key.length() - "-cells".length()), List.copyOf(cells));
                }
            }
        }

        Map<String, PropertySpec> propertySpecs = new LinkedHashMap<>();
        Map<String, ChildBinding> childBindings = new LinkedHashMap<>();
        JsonNode properties = document.get("properties");
        if (properties != null && properties.isObject()) {
            for (Iterator<Map.Entry<String, JsonNode>> it = properties.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String name = entry.getKey();
                JsonNode spec = entry.getValue();
                String propertyOrigin = origins.getOrDefault(name, origin);
                if (IncludeMerger.isNodeType(spec)) {
                    ObjectNode childDocument = spec.deepCopy();
                    Binding childBinding =
                            build(childDocument, propertyOrigin, Map.of(), true, false, false);
                    childBindings.put(
                            name,
                            new ChildBinding(name, IncludeMerger.compile(name, origin), List.of(childBinding)));
                } else {
                    propertySpecs.put(name, toPropertySpec(name, spec, propertyOrigin, origin));
                }
            }
        }

        return new Binding(
                kind,
                origin,
                schema,
                description,
                variant,
                buses,
                specifierCells,
                propertySpecs,
                childBindings,
                document,
                child);
    }

    private static PropertySpec toPropertySpec(String name, JsonNode spec, String propertyOrigin, String origin) {
        List<JsonNode> enumValues = null;
        if (spec.hasNonNull("enum")) {
            enumValues = new ArrayList<>();
            spec.get("enum").forEach(enumValues::add);
        }
        return new PropertySpec(
                name,
                IncludeMerger.compile(name, origin),
                PropertyType.fromTag(spec.get("type").asText()),
                spec.hasNonNull("description") ? spec.get("description").asText() : null,
                spec.path("required").asBoolean(false),
                spec.path("deprecated").asBoolean(false),
                enumValues,
                spec.hasNonNull("const") ? spec.get("const") : null,
                spec.hasNonNull("default") ? spec.get("default") : null,
                spec.hasNonNull("specifier-space") ? spec.get("specifier-space").asText() : null,
                propertyOrigin);
    }

    // --- I/O ---

    private static String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemaException("Failed to read binding file: " + e.getMessage(), e, file.toString());
        }
    }

    static ObjectNode readDocument(String sourceText, String origin) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(sourceText);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Failed to parse YAML in " + origin + ": " + e.getOriginalMessage(), e, origin);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new SchemaException(origin + ": invalid contents, expected a mapping", origin);
        }
        return (ObjectNode) root;
    }
}
