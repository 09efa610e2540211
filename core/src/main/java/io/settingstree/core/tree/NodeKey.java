package io.settingstree.core.tree;

import java.util.Comparator;
import java.util.Objects;

/**
 * Sort key of a node: parent path, then base name (before {@code @}), then unit address.
 *
 * @param parentPath  path of the parent, empty for the root
 * @param baseName    node name without its unit address
 * @param unitAddress unit address parsed as hex, or -1 when absent or not numeric
 */
public record NodeKey(String parentPath, String baseName, long unitAddress) implements Comparable<NodeKey> {

    private static final Comparator<NodeKey> ORDER = Comparator.comparing(NodeKey::parentPath)
            .thenComparing(NodeKey::baseName)
            .thenComparingLong(NodeKey::unitAddress);

    public NodeKey {
        Objects.requireNonNull(parentPath, "parentPath must not be null");
        Objects.requireNonNull(baseName, "baseName must not be null");
    }

    /** Derives the key of the node at {@code path}. */
    public static NodeKey of(String path) {
        if ("/".equals(path)) {
            return new NodeKey("", "/", -1);
        }
        int slash = path.lastIndexOf('/');
        String parentPath = slash == 0 ? "/" : path.substring(0, slash);
        String name = path.substring(slash + 1);
        int at = name.indexOf('@');
        if (at < 0) {
            return new NodeKey(parentPath, name, -1);
        }
        return new NodeKey(parentPath, name.substring(0, at), parseUnitAddress(name.substring(at + 1)));
    }

    private static long parseUnitAddress(String text) {
        try {
            return Long.parseUnsignedLong(text, 16);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public int compareTo(NodeKey other) {
        return ORDER.compare(this, other);
    }
}
