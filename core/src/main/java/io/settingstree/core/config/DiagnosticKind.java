package io.settingstree.core.config;

import java.util.Locale;

/**
 * Non-fatal findings reported while building a tree. Each kind is logged as a warning unless it is
 * listed in {@link TreeOptions#escalatedDiagnostics()}, in which case it fails the build.
 */
public enum DiagnosticKind {
    /** A schema id whose {@code vendor,} prefix is not in the vendor-prefix table. */
    UNKNOWN_VENDOR,
    /** A string enum whose values collide once converted to identifiers. */
    ENUM_NOT_TOKENIZABLE,
    /** A deprecated property that is set on a node. */
    DEPRECATED_PROPERTY,
    /** A register with a zero size or an address that does not translate cleanly. */
    REGISTER_MISMATCH;

    /** The kebab-case name used in option files and environment variables. */
    public String optionName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parses an option name such as {@code unknown-vendor}.
     *
     * @throws IllegalArgumentException if no kind has that name
     */
    public static DiagnosticKind fromOptionName(String name) {
        for (DiagnosticKind kind : values()) {
            if (kind.optionName().equals(name.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown diagnostic '" + name + "'");
    }
}
