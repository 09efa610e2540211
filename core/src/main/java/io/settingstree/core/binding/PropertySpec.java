package io.settingstree.core.binding;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The declaration of one property in a binding.
 *
 * @param name            property name, normally exact but possibly a pattern
 * @param pattern         {@code name} compiled for full matching
 * @param type            declared type
 * @param description     free-form description, or null
 * @param required        the property must be present on enabled nodes
 * @param deprecated      setting the property raises a diagnostic
 * @param enumValues      allowed values, or null when unrestricted
 * @param constValue      the only allowed value, or null
 * @param defaultValue    value used when the property is absent, or null
 * @param specifierSpace  explicit specifier space of a phandle-array, or null
 * @param origin          the binding file that last modified this declaration
 */
public record PropertySpec(
        String name,
        Pattern pattern,
        PropertyType type,
        String description,
        boolean required,
        boolean deprecated,
        List<JsonNode> enumValues,
        JsonNode constValue,
        JsonNode defaultValue,
        String specifierSpace,
        String origin) {

    private static final Pattern LITERAL_NAME = Pattern.compile("[#A-Za-z0-9,_+@-]+");

    public PropertySpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        if (enumValues != null) {
            enumValues = List.copyOf(enumValues);
        }
    }

    /** This declaration applied to the concrete property {@code propertyName} matched by its pattern. */
    public PropertySpec named(String propertyName) {
        return new PropertySpec(
                propertyName,
                pattern,
                type,
                description,
                required,
                deprecated,
                enumValues,
                constValue,
                defaultValue,
                specifierSpace,
                origin);
    }

    /** True when {@code propertyName} is covered by this declaration. */
    public boolean matches(String propertyName) {
        return name.equals(propertyName) || pattern.matcher(propertyName).matches();
    }

    /** True when the declared name contains no pattern syntax. */
    public boolean isLiteral() {
        return LITERAL_NAME.matcher(name).matches();
    }

    public boolean hasEnum() {
        return enumValues != null && !enumValues.isEmpty();
    }

    /**
     * True if this is a string or string-array property with an enum whose values stay unique once
     * every non-word character is replaced by {@code _}.
     */
    public boolean enumTokenizable() {
        if ((type != PropertyType.STRING && type != PropertyType.STRING_ARRAY) || !hasEnum()) {
            return false;
        }
        List<String> tokens = enumTokens();
        return new HashSet<>(tokens).size() == tokens.size();
    }

    /** Like {@link #enumTokenizable()}, additionally requiring uniqueness after upper-casing. */
    public boolean enumUpperTokenizable() {
        if (!enumTokenizable()) {
            return false;
        }
        List<String> tokens = enumTokens();
        Set<String> upper = tokens.stream().map(t -> t.toUpperCase(Locale.ROOT)).collect(Collectors.toSet());
        return upper.size() == tokens.size();
    }

    private List<String> enumTokens() {
        return enumValues.stream().map(v -> Tokens.asToken(v.asText())).collect(Collectors.toList());
    }
}
