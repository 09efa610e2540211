package io.settingstree.core.binding;

import java.util.List;

/**
 * Property filter applied to an included binding, and recursively to its child bindings.
 *
 * @param allowlist  names to keep, or null
 * @param blocklist  names to drop, or null
 * @param child      filter for the child bindings of the filtered document, or null
 */
public record IncludeFilter(List<String> allowlist, List<String> blocklist, IncludeFilter child) {

    public IncludeFilter {
        if (allowlist != null) {
            allowlist = List.copyOf(allowlist);
        }
        if (blocklist != null) {
            blocklist = List.copyOf(blocklist);
        }
    }

    /** A filter that keeps everything. */
    public static IncludeFilter none() {
        return new IncludeFilter(null, null, null);
    }

    public static IncludeFilter allow(List<String> names) {
        return new IncludeFilter(names, null, null);
    }

    public static IncludeFilter block(List<String> names) {
        return new IncludeFilter(null, names, null);
    }

    /** Returns a copy of this filter with {@code child} applied to child bindings. */
    public IncludeFilter withChild(IncludeFilter child) {
        return new IncludeFilter(allowlist, blocklist, child);
    }

    public boolean isEmpty() {
        return allowlist == null && blocklist == null && child == null;
    }
}
