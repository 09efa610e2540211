package io.settingstree.core.binding;

import io.settingstree.core.error.SchemaException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable table of the bindings available to one source, keyed by {@code (schema, variant)}.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class BindingRegistry {

    private final Map<Key, Binding> bindings;

    private BindingRegistry(Map<Key, Binding> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /** A registry with no bindings. */
    public static BindingRegistry empty() {
        return new BindingRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the binding for a schema id on a bus.
     *
     * @param schema  the schema id
     * @param variant the bus the node sits on, or null for the variant-less binding
     * @return the binding, or null if none is registered
     */
    public Binding binding(String schema, String variant) {
        return bindings.get(new Key(schema, variant));
    }

    /** All registered bindings, in registration order. */
    public Collection<Binding> bindings() {
        return bindings.values();
    }

    /** Every schema id that has at least one binding. */
    public Set<String> schemas() {
        Set<String> schemas = new LinkedHashSet<>();
        bindings.keySet().forEach(key -> schemas.add(key.schema()));
        return schemas;
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    private record Key(String schema, String variant) {}

    /** Builder for {@link BindingRegistry}. */
    public static final class Builder {

        private final Map<Key, Binding> bindings = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers {@code binding} under its schema and variant.
         *
         * @throws SchemaException if another binding already claims the same pair
         */
        public Builder register(Binding binding) {
            Objects.requireNonNull(binding.schema(), "only bindings with a schema can be registered");
            Key key = new Key(binding.schema(), binding.variant());
            Binding existing = bindings.get(key);
            if (existing != null) {
                String message = "both " + existing.origin() + " and " + binding.origin() + " have schema '"
                        + binding.schema() + "'";
                if (binding.variant() != null) {
                    message += " and 'binding variant " + binding.variant() + "'";
                }
                throw new SchemaException(message, binding.origin());
            }
            bindings.put(key, binding);
            return this;
        }

        /** Registers {@code binding} and, recursively, its child bindings that declare a schema. */
        public Builder registerWithChildren(Binding binding) {
            if (binding.schema() == null) {
                return this;
            }
            register(binding);
            List<Binding> children = new ArrayList<>();
            binding.childBindings().values().forEach(child -> children.addAll(child.bindings()));
            children.forEach(this::registerWithChildren);
            return this;
        }

        public BindingRegistry build() {
            return new BindingRegistry(bindings);
        }
    }
}
