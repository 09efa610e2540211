package io.settingstree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import io.settingstree.core.binding.Binding;
import io.settingstree.core.binding.PropertySpec;
import io.settingstree.core.error.PropertyException;
import io.settingstree.core.model.RawNode;
import io.settingstree.core.model.SourceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Configuration source rules: {@code schema} and {@code enabled} markers, nothing bus related. */
final class ConfigDriver implements SourceDriver {

    private final PartialTree tree;

    ConfigDriver(PartialTree tree) {
        this.tree = tree;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.CONFIG;
    }

    @Override
    public List<String> schemas(RawNode raw) {
        JsonNode schema = raw.property("schema");
        if (schema == null) {
            return List.of();
        }
        if (schema.isTextual()) {
            return List.of(schema.asText());
        }
        List<String> schemas = new ArrayList<>();
        if (schema.isArray()) {
            for (JsonNode element : schema) {
                if (!element.isTextual()) {
                    throw invalidSchema(raw, schema);
                }
                schemas.add(element.asText());
            }
            return schemas;
        }
        throw invalidSchema(raw, schema);
    }

    private static PropertyException invalidSchema(RawNode raw, JsonNode schema) {
        return new PropertyException(
                "Invalid 'schema' property in config node " + raw.path() + ": " + schema, raw.path(), "schema");
    }

    @Override
    public boolean enabled(RawNode raw) {
        JsonNode enabled = raw.property("enabled");
        if (enabled == null) {
            return true;
        }
        if (!enabled.isBoolean()) {
            throw new PropertyException(
                    "Invalid 'enabled' property in config node " + raw.path() + ": expected a boolean, not "
                            + enabled,
                    raw.path(),
                    "enabled");
        }
        return enabled.asBoolean();
    }

    @Override
    public boolean isImplicitlyDeclared(String propertyName) {
        return false;
    }

    @Override
    public void beforeBindings(PartialTreeNode node) {
        // no buses in configuration trees
    }

    @Override
    public Binding bindingFor(PartialTreeNode node, String schema) {
        return tree.registry().binding(schema, null);
    }

    @Override
    public Binding inferredBinding(PartialTreeNode node) {
        return null;
    }

    @Override
    public Map<String, PropertySpec> defaultSpecs() {
        return Map.of();
    }

    @Override
    public void afterBindings(PartialTreeNode node) {
        // nothing beyond the shared properties
    }

    @Override
    public void resolveCrossReferences(PartialTreeNode node) {
        // pointers are resolved with the other properties
    }

    @Override
    public void check(PartialTreeNode node) {
        // no source-specific checks
    }

    @Override
    public List<Node> sourceDependencies(PartialTreeNode node) {
        return List.of();
    }
}
