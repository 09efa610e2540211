package io.settingstree.core.binding;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.config.TreeOptions;
import io.settingstree.core.error.SchemaException;
import io.settingstree.core.model.SourceKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the binding files in a set of directories and registers those whose schema a source
 * uses.
 */
public final class BindingScanner {

    private static final Logger LOG = LoggerFactory.getLogger(BindingScanner.class);

    private BindingScanner() {
        // utility class
    }

    /**
     * Scans {@code bindingDirs} recursively for {@code .yaml} and {@code .yml} files.
     *
     * @param kind        source kind whose binding rules apply
     * @param bindingDirs directories to search
     * @param usedSchemas schema ids referenced by the source; other bindings are skipped
     * @param options     tree options passed to the parser
     * @return the registry of matching bindings
     * @throws SchemaException on unreadable files, invalid bindings or duplicate registrations
     */
    public static BindingRegistry scan(
            SourceKind kind, List<Path> bindingDirs, Set<String> usedSchemas, TreeOptions options) {
        List<Path> files = bindingFiles(bindingDirs);
        Map<String, Path> fileNameToPath = new LinkedHashMap<>();
        for (Path file : files) {
            fileNameToPath.put(file.getFileName().toString(), file);
        }
        BindingParser parser = new BindingParser(kind, IncludeResolver.of(fileNameToPath), options);
        BindingRegistry.Builder builder = BindingRegistry.builder();

        for (Path file : files) {
            String text = readText(file);
            // cheap textual pre-filter before parsing
            if (usedSchemas.stream().noneMatch(text::contains)) {
                continue;
            }
            JsonNode document = BindingParser.readDocument(text, file.toString());
            String schemaKey = kind == SourceKind.HARDWARE && !document.has("schema")
                    ? SourceKind.HARDWARE.schemaProperty()
                    : "schema";
            JsonNode schema = document.get(schemaKey);
            if (schema == null || !schema.isTextual() || !usedSchemas.contains(schema.asText())) {
                continue;
            }
            builder.registerWithChildren(parser.parse(file));
        }

        BindingRegistry registry = builder.build();
        LOG.info("Bindings registered: kind={}, files={}, bindings={}", kind, files.size(), registry.size());
        return registry;
    }

    /** All binding files below {@code bindingDirs}, sorted per directory for stable results. */
    static List<Path> bindingFiles(List<Path> bindingDirs) {
        List<Path> files = new ArrayList<>();
        for (Path dir : bindingDirs) {
            if (!Files.isDirectory(dir)) {
                throw new SchemaException("Binding directory not found: " + dir, dir.toString());
            }
            try (Stream<Path> walk = Files.walk(dir)) {
                files.addAll(walk.filter(Files::isRegularFile)
                        .filter(p -> {
                            String name = p.getFileName().toString();
                            return name.endsWith(".yaml") || name.endsWith(".yml");
                        })
                        .sorted()
                        .collect(Collectors.toList()));
            } catch (IOException e) {
                throw new SchemaException("Failed to scan binding directory: " + dir, e, dir.toString());
            }
        }
        return files;
    }

    private static String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemaException("Failed to read binding file: " + file, e, file.toString());
        }
    }
}
