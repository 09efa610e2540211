package io.settingstree.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads {@link TreeOptions} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Layout of the options file (every key optional):
 *
 * <pre>
 * bindings:
 *   dirs: [dts/bindings, settings/bindings]
 *   require-schema: true
 *   require-description: true
 *   overridable-keys: [title, description, schema]
 * hardware:
 *   default-property-types: true
 *   fixed-partitions-on-any-bus: true
 *   infer-binding-for-paths: [/chosen]
 * vendor-prefixes: dts/bindings/vendor-prefixes.txt
 * diagnostics:
 *   errors: [unknown-vendor, deprecated-property]
 * </pre>
 *
 * <p>
 * Relative paths are resolved against the directory holding the options file.
 *
 * <p>
 * Environment overlay: {@code SETTINGS_TREE_BINDING_DIRS} (comma separated),
 * {@code SETTINGS_TREE_VENDOR_PREFIXES}, {@code SETTINGS_TREE_REQUIRE_DESCRIPTION},
 * {@code SETTINGS_TREE_DEFAULT_PROPERTY_TYPES} and {@code SETTINGS_TREE_ERRORS} (comma separated
 * diagnostic names) take precedence over the file. A variable counts as set only if it is defined
 * and non-blank after trimming.
 */
public final class TreeOptionsLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String ENV_PREFIX = "SETTINGS_TREE_";

    private TreeOptionsLoader() {
        // utility class
    }

    /**
     * Loads options from the given file, applying overrides from {@link System#getenv}.
     *
     * @param optionsPath path to the YAML options file
     * @return the options with defaults applied
     * @throws OptionsLoadException if the file is missing or malformed
     */
    public static TreeOptions load(Path optionsPath) {
        return load(optionsPath, System::getenv);
    }

    /**
     * Loads options from the given file, applying overrides from the supplied lookup. The lookup
     * returns {@code null} for undefined variables.
     *
     * @param optionsPath path to the YAML options file
     * @param envLookup   environment variable lookup function
     * @return the options with defaults and overrides applied
     * @throws OptionsLoadException if the file is missing or malformed
     */
    public static TreeOptions load(Path optionsPath, Function<String, String> envLookup) {
        if (!Files.exists(optionsPath)) {
            throw new OptionsLoadException("Options file not found: " + optionsPath);
        }
        try (InputStream in = Files.newInputStream(optionsPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            Path baseDir = optionsPath.toAbsolutePath().getParent();
            return mapToOptions(root == null ? YAML_MAPPER.createObjectNode() : root, baseDir, envLookup);
        } catch (OptionsLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new OptionsLoadException("Failed to parse YAML options: " + optionsPath, e);
        } catch (IllegalArgumentException e) {
            throw new OptionsLoadException("Invalid options in " + optionsPath + ": " + e.getMessage(), e);
        }
    }

    /** Builds options from environment variables only, starting from the defaults. */
    public static TreeOptions fromEnvironment(Function<String, String> envLookup) {
        TreeOptions.Builder builder = TreeOptions.builder();
        applyEnvOverrides(builder, Path.of(""), envLookup);
        return builder.build();
    }

    private static TreeOptions mapToOptions(JsonNode root, Path baseDir, Function<String, String> envLookup) {
        TreeOptions.Builder builder = TreeOptions.builder();

        // --- YAML mapping ---

        JsonNode bindings = root.path("bindings");
        if (bindings.has("dirs")) {
            builder.bindingDirs(stringList(bindings, "dirs").stream()
                    .map(dir -> baseDir.resolve(dir))
                    .collect(Collectors.toList()));
        }
        builder.requireSchema(boolOrDefault(bindings, "require-schema", true));
        builder.requireDescription(boolOrDefault(bindings, "require-description", true));
        if (bindings.has("overridable-keys")) {
            builder.overridableKeys(new LinkedHashSet<>(stringList(bindings, "overridable-keys")));
        }

        JsonNode hardware = root.path("hardware");
        builder.defaultPropertyTypes(boolOrDefault(hardware, "default-property-types", true));
        builder.fixedPartitionsOnAnyBus(boolOrDefault(hardware, "fixed-partitions-on-any-bus", true));
        if (hardware.has("infer-binding-for-paths")) {
            builder.inferBindingForPaths(stringList(hardware, "infer-binding-for-paths"));
        }

        String vendorPrefixes = textOrNull(root, "vendor-prefixes");
        if (vendorPrefixes != null) {
            builder.vendorPrefixes(baseDir.resolve(vendorPrefixes));
        }

        JsonNode diagnostics = root.path("diagnostics");
        if (diagnostics.has("errors")) {
            builder.escalatedDiagnostics(parseDiagnostics(stringList(diagnostics, "errors")));
        }

        applyEnvOverrides(builder, baseDir, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(
            TreeOptions.Builder builder, Path baseDir, Function<String, String> envLookup) {
        envString(envLookup, "BINDING_DIRS", value -> builder.bindingDirs(splitList(value).stream()
                .map(dir -> baseDir.resolve(dir))
                .collect(Collectors.toList())));
        envString(envLookup, "VENDOR_PREFIXES", value -> builder.vendorPrefixes(baseDir.resolve(value)));
        envBool(envLookup, "REQUIRE_DESCRIPTION", builder::requireDescription);
        envBool(envLookup, "DEFAULT_PROPERTY_TYPES", builder::defaultPropertyTypes);
        envString(envLookup, "ERRORS", value -> builder.escalatedDiagnostics(parseDiagnostics(splitList(value))));
    }

    private static Set<DiagnosticKind> parseDiagnostics(List<String> names) {
        Set<DiagnosticKind> kinds = EnumSet.noneOf(DiagnosticKind.class);
        for (String name : names) {
            kinds.add(DiagnosticKind.fromOptionName(name));
        }
        return kinds;
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(ENV_PREFIX + envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(ENV_PREFIX + envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(ENV_PREFIX + envVar).trim()));
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.has(field) ? node.get(field).asText() : null;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }

    private static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<String> result = new ArrayList<>();
        if (value.isTextual()) {
            result.add(value.asText());
        } else if (value.isArray()) {
            value.forEach(element -> result.add(element.asText()));
        } else {
            throw new OptionsLoadException("'" + field + "' must be a string or a list of strings");
        }
        return result;
    }
}
