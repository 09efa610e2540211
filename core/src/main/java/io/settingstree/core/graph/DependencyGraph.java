package io.settingstree.core.graph;

import io.settingstree.core.error.GraphException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A directed dependency graph. An edge from {@code source} to {@code target} means that
 * {@code source} requires {@code target} to be available first.
 *
 * <p>
 * {@link #orderedSccs()} computes the strongly connected components with Tarjan's algorithm, in
 * dependency order: no vertex depends on a vertex of a later component. An acyclic graph has one
 * vertex per component. The result is cached until the graph changes.
 *
 * <p>
 * Every traversal visits vertices sorted by the graph's comparator, so the order is deterministic.
 *
 * @param <V> vertex type, compared with {@link Object#equals(Object)}
 */
public final class DependencyGraph<V> {

    private final Comparator<? super V> order;
    private final V explicitRoot;
    private final Set<V> vertices = new LinkedHashSet<>();
    private final Map<V, Set<V>> edges = new HashMap<>();
    private final Map<V, Set<V>> reverseEdges = new HashMap<>();

    private List<List<V>> orderedSccs;

    /** A graph whose roots are the vertices without incoming edges. */
    public DependencyGraph(Comparator<? super V> order) {
        this(order, null);
    }

    /**
     * A graph traversed from {@code explicitRoot} only.
     *
     * @param order        ordering applied to roots and edge targets
     * @param explicitRoot the single root, or null to compute roots
     */
    public DependencyGraph(Comparator<? super V> order, V explicitRoot) {
        this.order = Objects.requireNonNull(order, "order must not be null");
        this.explicitRoot = explicitRoot;
    }

    /** Adds a vertex without any dependency. */
    public void addNode(V vertex) {
        Objects.requireNonNull(vertex, "vertex must not be null");
        vertices.add(vertex);
        orderedSccs = null;
    }

    /** Adds an edge {@code source -> target}, adding both vertices if needed. */
    public void addEdge(V source, V target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        edges.computeIfAbsent(source, k -> new HashSet<>()).add(target);
        if (!source.equals(target)) {
            reverseEdges.computeIfAbsent(target, k -> new HashSet<>()).add(source);
        }
        addNode(source);
        addNode(target);
    }

    public Set<V> vertices() {
        return Collections.unmodifiableSet(vertices);
    }

    public int size() {
        return vertices.size();
    }

    /** The vertices {@code vertex} directly depends on, sorted. */
    public List<V> dependsOn(V vertex) {
        return sorted(edges.getOrDefault(vertex, Set.of()));
    }

    /** The vertices directly depending on {@code vertex}, sorted. */
    public List<V> requiredBy(V vertex) {
        return sorted(reverseEdges.getOrDefault(vertex, Set.of()));
    }

    /**
     * The strongly connected components in dependency order.
     *
     * @throws GraphException if the graph is not empty but has no root
     */
    public List<List<V>> orderedSccs() {
        if (orderedSccs == null) {
            orderedSccs = Collections.unmodifiableList(new Tarjan().run());
        }
        return orderedSccs;
    }

    /** Vertices nothing depends on, sorted; or the explicit root. */
    public List<V> roots() {
        if (explicitRoot != null) {
            return List.of(explicitRoot);
        }
        List<V> roots = new ArrayList<>();
        for (V vertex : vertices) {
            if (!reverseEdges.containsKey(vertex)) {
                roots.add(vertex);
            }
        }
        roots.sort(order);
        return roots;
    }

    private List<V> sorted(Set<V> set) {
        List<V> list = new ArrayList<>(set);
        list.sort(order);
        return list;
    }

    // --- Tarjan ---

    private final class Tarjan {

        private final List<List<V>> result = new ArrayList<>();
        private final Deque<V> stack = new ArrayDeque<>();
        private final Set<V> onStack = new HashSet<>();
        private final Map<V, Integer> index = new LinkedHashMap<>();
        private final Map<V, Integer> lowLink = new HashMap<>();
        private int next;

        List<List<V>> run() {
            List<V> roots = roots();
            if (!vertices.isEmpty() && roots.isEmpty()) {
                throw new GraphException("No roots found in graph with " + vertices.size() + " nodes");
            }
            for (V root : roots) {
                if (!index.containsKey(root)) {
                    visit(root);
                }
            }
            return result;
        }

        private void visit(V vertex) {
            index.put(vertex, next);
            lowLink.put(vertex, next);
            next++;
            stack.push(vertex);
            onStack.add(vertex);

            for (V target : dependsOn(vertex)) {
                if (!index.containsKey(target)) {
                    visit(target);
                    lowLink.put(vertex, Math.min(lowLink.get(vertex), lowLink.get(target)));
                } else if (onStack.contains(target)) {
                    lowLink.put(vertex, Math.min(lowLink.get(vertex), index.get(target)));
                }
            }

            if (lowLink.get(vertex).equals(index.get(vertex))) {
                List<V> scc = new ArrayList<>();
                V member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    scc.add(member);
                } while (!member.equals(vertex));
                result.add(Collections.unmodifiableList(scc));
            }
        }
    }
}
