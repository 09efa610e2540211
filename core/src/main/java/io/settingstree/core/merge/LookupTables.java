package io.settingstree.core.merge;

import io.settingstree.core.config.DiagnosticKind;
import io.settingstree.core.config.Diagnostics;
import io.settingstree.core.error.MergeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Read-only indexes over the entities of a processed {@link MergedTree}.
 *
 * <p>
 * Entities listed per schema are in build order, enabled entities first.
 */
public final class LookupTables {

    static final Pattern SCHEMA_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9,+\\-._]+$");

    private final Map<String, List<MergedEntity>> schemaToEntities;
    private final Map<String, List<MergedEntity>> schemaToEnabled;
    private final Map<String, List<MergedEntity>> schemaToDisabled;
    private final Map<String, String> schemaToVendor;
    private final Map<String, String> schemaToModel;
    private final Map<Integer, MergedEntity> ordinalToEntity;
    private final Map<String, MergedEntity> labelToEntity;
    private final Map<String, MergedEntity> pathToEntity;

    private LookupTables(Builder builder) {
        this.schemaToEntities = freeze(builder.schemaToEntities);
        this.schemaToEnabled = freeze(builder.schemaToEnabled);
        this.schemaToDisabled = freeze(builder.schemaToDisabled);
        this.schemaToVendor = Collections.unmodifiableMap(builder.schemaToVendor);
        this.schemaToModel = Collections.unmodifiableMap(builder.schemaToModel);
        this.ordinalToEntity = Collections.unmodifiableMap(builder.ordinalToEntity);
        this.labelToEntity = Collections.unmodifiableMap(builder.labelToEntity);
        this.pathToEntity = Collections.unmodifiableMap(builder.pathToEntity);
    }

    /**
     * Builds the tables.
     *
     * @param entities       every entity in build order, ordinals assigned
     * @param labels         labels that are unique across all sources
     * @param vendorPrefixes known vendor prefixes; empty disables vendor checks
     * @param diagnostics    receives {@link DiagnosticKind#UNKNOWN_VENDOR}
     * @throws MergeException if a schema id is malformed
     */
    static LookupTables build(
            List<MergedEntity> entities,
            Map<String, MergedEntity> labels,
            Map<String, String> vendorPrefixes,
            Diagnostics diagnostics) {
        Builder builder = new Builder();
        Set<String> checked = new HashSet<>();
        for (MergedEntity entity : entities) {
            builder.pathToEntity.put(entity.path(), entity);
            builder.ordinalToEntity.put(entity.ordinal(), entity);
            for (String schema : entity.schemas()) {
                (entity.enabled() ? builder.schemaToEnabled : builder.schemaToDisabled)
                        .computeIfAbsent(schema, k -> new ArrayList<>())
                        .add(entity);
                if (!checked.contains(schema)) {
                    checkSchema(entity, schema, vendorPrefixes, diagnostics, builder);
                    if (!"/".equals(entity.path())) {
                        checked.add(schema);
                    }
                }
            }
        }
        builder.schemaToEnabled.forEach((schema, list) ->
                builder.schemaToEntities.computeIfAbsent(schema, k -> new ArrayList<>()).addAll(list));
        builder.schemaToDisabled.forEach((schema, list) ->
                builder.schemaToEntities.computeIfAbsent(schema, k -> new ArrayList<>()).addAll(list));
        builder.labelToEntity.putAll(labels);
        return new LookupTables(builder);
    }

    private static void checkSchema(
            MergedEntity entity,
            String schema,
            Map<String, String> vendorPrefixes,
            Diagnostics diagnostics,
            Builder builder) {
        if (!SCHEMA_PATTERN.matcher(schema).matches()) {
            throw new MergeException(
                    "node '" + entity.path() + "' schema '" + schema + "' must match this regular expression: '"
                            + SCHEMA_PATTERN.pattern() + "'",
                    entity.path());
        }
        int comma = schema.indexOf(',');
        if (comma < 0 || vendorPrefixes.isEmpty()) {
            return;
        }
        String vendor = schema.substring(0, comma);
        if (vendorPrefixes.containsKey(vendor)) {
            builder.schemaToVendor.put(schema, vendorPrefixes.get(vendor));
            builder.schemaToModel.put(schema, schema.substring(comma + 1));
        } else if (!"/".equals(entity.path())) {
            // the root may use any schema
            String message = "node '" + entity.path() + "' schema '" + schema + "' has unknown vendor prefix '"
                    + vendor + "'";
            diagnostics.report(DiagnosticKind.UNKNOWN_VENDOR, message,
                    () -> new MergeException(message, entity.path()));
        }
    }

    private static Map<String, List<MergedEntity>> freeze(Map<String, List<MergedEntity>> map) {
        Map<String, List<MergedEntity>> frozen = new LinkedHashMap<>();
        map.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    /** Entities listing {@code schema}, enabled first; empty if none. */
    public List<MergedEntity> bySchema(String schema) {
        return schemaToEntities.getOrDefault(schema, List.of());
    }

    public List<MergedEntity> enabledBySchema(String schema) {
        return schemaToEnabled.getOrDefault(schema, List.of());
    }

    public List<MergedEntity> disabledBySchema(String schema) {
        return schemaToDisabled.getOrDefault(schema, List.of());
    }

    public Map<String, List<MergedEntity>> schemaToEntities() {
        return schemaToEntities;
    }

    /** Vendor name of schema ids whose prefix is known. */
    public Map<String, String> schemaToVendor() {
        return schemaToVendor;
    }

    /** The part after the vendor prefix, for schema ids whose prefix is known. */
    public Map<String, String> schemaToModel() {
        return schemaToModel;
    }

    /** Entities by dependency ordinal, in ordinal order. */
    public Map<Integer, MergedEntity> ordinalToEntity() {
        return ordinalToEntity;
    }

    public Map<String, MergedEntity> labelToEntity() {
        return labelToEntity;
    }

    public Map<String, MergedEntity> pathToEntity() {
        return pathToEntity;
    }

    private static final class Builder {
        private final Map<String, List<MergedEntity>> schemaToEntities = new LinkedHashMap<>();
        private final Map<String, List<MergedEntity>> schemaToEnabled = new LinkedHashMap<>();
        private final Map<String, List<MergedEntity>> schemaToDisabled = new LinkedHashMap<>();
        private final Map<String, String> schemaToVendor = new LinkedHashMap<>();
        private final Map<String, String> schemaToModel = new LinkedHashMap<>();
        private final Map<Integer, MergedEntity> ordinalToEntity = new TreeMap<>();
        private final Map<String, MergedEntity> labelToEntity = new LinkedHashMap<>();
        private final Map<String, MergedEntity> pathToEntity = new LinkedHashMap<>();
    }
}
