package com.scenetree.hierarchy;

import java.util.Objects;
import java.util.function.Predicate;

/** The predicates hosts search by. */
public final class NodePredicates {
    private NodePredicates() {}

    /** Exact, case-sensitive name equality. */
    public static <N> Predicate<N> named(HierarchyTC<N> tc, String name) {
        Objects.requireNonNull(tc, "tc");
        Objects.requireNonNull(name, "name");
        return n -> name.equals(tc.name(n));
    }

    /** Tag membership; an unregistered tag fails on the first node tested. */
    public static <N> Predicate<N> tagged(HierarchyTC<N> tc, String tag) {
        Objects.requireNonNull(tc, "tc");
        Objects.requireNonNull(tag, "tag");
        return n -> tc.hasTag(n, tag);
    }

    public static <N> Predicate<N> active(HierarchyTC<N> tc) {
        Objects.requireNonNull(tc, "tc");
        return tc::isActive;
    }
}
