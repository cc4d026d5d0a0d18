package com.scenetree.hierarchy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Searches over a host-owned tree described by a {@link HierarchyTC}.
 * <p>
 * Every operation is a synchronous read of the tree as it is at call time. Nothing is cached:
 * the host may reparent, rename or deactivate nodes between calls. The starting node is never
 * part of its own result (descendant search starts at its children, ancestor search at its parent).
 * Not finding anything is a normal result, reported as {@link Optional#empty()} or an empty list.
 * Exceptions thrown by the predicate or the typeclass (for example an unknown tag) propagate.
 */
public interface HierarchySearch {

    String DEFAULT_SEPARATOR = "/";

    /** {@link #findDescendant(Object, Predicate, boolean, SearchOrder, HierarchyTC)} depth first. */
    static <N> Optional<N> findDescendant(N root, Predicate<? super N> predicate, boolean mustBeActive, HierarchyTC<N> tc) {
        return findDescendant(root, predicate, mustBeActive, SearchOrder.DEPTH_FIRST, tc);
    }

    /**
     * First descendant of {@code root} matching {@code predicate} (and active, if {@code mustBeActive}).
     * Inactive nodes are still descended into; the flag only decides whether a node may be returned.
     */
    static <N> Optional<N> findDescendant(N root, Predicate<? super N> predicate, boolean mustBeActive,
                                          SearchOrder order, HierarchyTC<N> tc) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(tc, "tc");
        N found = switch (order) {
            case DEPTH_FIRST -> depthFirst(root, predicate, mustBeActive, tc);
            case BREADTH_FIRST -> breadthFirst(root, predicate, mustBeActive, tc);
        };
        return Optional.ofNullable(found);
    }

    /** Every matching descendant of {@code root}, in pre-order. Never null. */
    static <N> List<N> findDescendants(N root, Predicate<? super N> predicate, boolean mustBeActive, HierarchyTC<N> tc) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(tc, "tc");
        List<N> found = new ArrayList<>();
        collect(root, predicate, mustBeActive, tc, found);
        return found;
    }

    /** Nearest ancestor matching {@code predicate}, whatever its activation state. */
    static <N> Optional<N> findAncestor(N node, Predicate<? super N> predicate, HierarchyTC<N> tc) {
        return findAncestor(node, predicate, false, tc);
    }

    /** Nearest ancestor matching {@code predicate}; with {@code mustBeActive} inactive ancestors are skipped. */
    static <N> Optional<N> findAncestor(N node, Predicate<? super N> predicate, boolean mustBeActive, HierarchyTC<N> tc) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(tc, "tc");
        Optional<N> current = tc.parent(node);
        while (current.isPresent()) {
            N candidate = current.get();
            if (matches(candidate, predicate, mustBeActive, tc)) return current;
            current = tc.parent(candidate);
        }
        return Optional.empty();
    }

    /** Full path from the root, e.g. {@code /A/B/D}. */
    static <N> String pathOf(N node, HierarchyTC<N> tc) {
        return pathOf(node, DEFAULT_SEPARATOR, tc);
    }

    /** Full path from the root, each name preceded by {@code separator}. */
    static <N> String pathOf(N node, String separator, HierarchyTC<N> tc) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(separator, "separator");
        Objects.requireNonNull(tc, "tc");
        Deque<String> names = new ArrayDeque<>();
        Optional<N> current = Optional.of(node);
        while (current.isPresent()) {
            names.addFirst(tc.name(current.get()));
            current = tc.parent(current.get());
        }
        StringBuilder path = new StringBuilder();
        for (String name : names) path.append(separator).append(name);
        return path.toString();
    }

    // --- internal ---

    private static <N> boolean matches(N node, Predicate<? super N> predicate, boolean mustBeActive, HierarchyTC<N> tc) {
        return predicate.test(node) && (!mustBeActive || tc.isActive(node));
    }

    private static <N> N depthFirst(N parent, Predicate<? super N> predicate, boolean mustBeActive, HierarchyTC<N> tc) {
        for (N child : tc.children(parent)) {
            if (matches(child, predicate, mustBeActive, tc)) return child;
            N grandchild = depthFirst(child, predicate, mustBeActive, tc);
            if (grandchild != null) return grandchild;
        }
        return null;
    }

    private static <N> N breadthFirst(N root, Predicate<? super N> predicate, boolean mustBeActive, HierarchyTC<N> tc) {
        Deque<N> queue = new ArrayDeque<>(tc.children(root));
        while (!queue.isEmpty()) {
            N next = queue.poll();
            if (matches(next, predicate, mustBeActive, tc)) return next;
            queue.addAll(tc.children(next));
        }
        return null;
    }

    private static <N> void collect(N parent, Predicate<? super N> predicate, boolean mustBeActive, HierarchyTC<N> tc, List<N> found) {
        for (N child : tc.children(parent)) {
            if (matches(child, predicate, mustBeActive, tc)) found.add(child);
            collect(child, predicate, mustBeActive, tc, found);
        }
    }
}
