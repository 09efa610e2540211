package io.settingstree.core.binding;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Bindings imposed on the children of a node whose name matches {@code pattern}.
 *
 * @param pattern  child node name pattern, {@code .*} for a plain {@code child-binding:}
 * @param regex    {@code pattern} compiled for full matching
 * @param bindings bindings applied to matching children
 */
public record ChildBinding(String pattern, Pattern regex, List<Binding> bindings) {

    public ChildBinding {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(regex, "regex must not be null");
        bindings = List.copyOf(Objects.requireNonNull(bindings, "bindings must not be null"));
    }

    /** True when a child named {@code childName} receives these bindings. */
    public boolean matches(String childName) {
        return regex.matcher(childName).matches();
    }
}
