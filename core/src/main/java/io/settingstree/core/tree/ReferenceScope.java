package io.settingstree.core.tree;

/**
 * Nodes outside the tree being processed that references may resolve to, typically the entities
 * merged from sources processed earlier.
 */
public interface ReferenceScope {

    /** A scope that resolves nothing. */
    ReferenceScope EMPTY = new ReferenceScope() {
        @Override
        public Node nodeByLabel(String label) {
            return null;
        }

        @Override
        public Node nodeByPath(String path) {
            return null;
        }
    };

    /** Returns the node with the unique label {@code label}, or null. */
    Node nodeByLabel(String label);

    /** Returns the node at {@code path}, or null. */
    Node nodeByPath(String path);
}
