package io.settingstree.core.config;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Options controlling how partial trees and the merged tree are built.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a documented default.
 *
 * @param bindingDirs              directories searched recursively for binding documents
 * @param requireSchema            binding documents must declare a schema id
 * @param requireDescription       binding documents must declare a description
 * @param defaultPropertyTypes     hardware nodes without bindings get typed standard properties
 * @param fixedPartitionsOnAnyBus  {@code fixed-partitions} nodes never take a bus node
 * @param inferBindingForPaths     hardware node paths whose binding is inferred from their values
 * @param vendorPrefixes           vendor-prefix table file, or {@code null} to skip vendor checks
 * @param escalatedDiagnostics     diagnostics that fail the build instead of logging a warning
 * @param overridableKeys          binding keys an including file may override without error
 */
public record TreeOptions(
        List<Path> bindingDirs,
        boolean requireSchema,
        boolean requireDescription,
        boolean defaultPropertyTypes,
        boolean fixedPartitionsOnAnyBus,
        List<String> inferBindingForPaths,
        Path vendorPrefixes,
        Set<DiagnosticKind> escalatedDiagnostics,
        Set<String> overridableKeys) {

    /** Binding keys that an including document may silently override. */
    public static final Set<String> DEFAULT_OVERRIDABLE_KEYS = Set.of("title", "description", "schema");

    public TreeOptions {
        bindingDirs = List.copyOf(Objects.requireNonNull(bindingDirs, "bindingDirs must not be null"));
        inferBindingForPaths = List.copyOf(
                Objects.requireNonNull(inferBindingForPaths, "inferBindingForPaths must not be null"));
        escalatedDiagnostics = Set.copyOf(
                Objects.requireNonNull(escalatedDiagnostics, "escalatedDiagnostics must not be null"));
        overridableKeys = Set.copyOf(Objects.requireNonNull(overridableKeys, "overridableKeys must not be null"));
    }

    /** Options with every default applied. */
    public static TreeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The diagnostic router configured by these options. */
    public Diagnostics diagnostics() {
        return new Diagnostics(escalatedDiagnostics);
    }

    /** Builder for {@link TreeOptions}. */
    public static final class Builder {
        private List<Path> bindingDirs = List.of();
        private boolean requireSchema = true;
        private boolean requireDescription = true;
        private boolean defaultPropertyTypes = true;
        private boolean fixedPartitionsOnAnyBus = true;
        private List<String> inferBindingForPaths = List.of();
        private Path vendorPrefixes;
        private final Set<DiagnosticKind> escalatedDiagnostics = EnumSet.noneOf(DiagnosticKind.class);
        private Set<String> overridableKeys = DEFAULT_OVERRIDABLE_KEYS;

        Builder() {}

        public Builder bindingDirs(List<Path> bindingDirs) {
            this.bindingDirs = bindingDirs;
            return this;
        }

        public Builder requireSchema(boolean requireSchema) {
            this.requireSchema = requireSchema;
            return this;
        }

        public Builder requireDescription(boolean requireDescription) {
            this.requireDescription = requireDescription;
            return this;
        }

        public Builder defaultPropertyTypes(boolean defaultPropertyTypes) {
            this.defaultPropertyTypes = defaultPropertyTypes;
            return this;
        }

        public Builder fixedPartitionsOnAnyBus(boolean fixedPartitionsOnAnyBus) {
            this.fixedPartitionsOnAnyBus = fixedPartitionsOnAnyBus;
            return this;
        }

        public Builder inferBindingForPaths(List<String> inferBindingForPaths) {
            this.inferBindingForPaths = inferBindingForPaths;
            return this;
        }

        public Builder vendorPrefixes(Path vendorPrefixes) {
            this.vendorPrefixes = vendorPrefixes;
            return this;
        }

        public Builder escalate(DiagnosticKind kind) {
            this.escalatedDiagnostics.add(kind);
            return this;
        }

        public Builder escalatedDiagnostics(Set<DiagnosticKind> kinds) {
            this.escalatedDiagnostics.clear();
            this.escalatedDiagnostics.addAll(kinds);
            return this;
        }

        public Builder overridableKeys(Set<String> overridableKeys) {
            this.overridableKeys = new LinkedHashSet<>(overridableKeys);
            return this;
        }

        public TreeOptions build() {
            return new TreeOptions(
                    bindingDirs,
                    requireSchema,
                    requireDescription,
                    defaultPropertyTypes,
                    fixedPartitionsOnAnyBus,
                    inferBindingForPaths,
                    vendorPrefixes,
                    escalatedDiagnostics,
                    overridableKeys);
        }
    }
}
