package com.scenetree.hierarchy;

import java.util.Locale;
import java.util.Optional;

/** Which matching descendant wins when several exist. */
public enum SearchOrder {
    /** First match in pre-order: a node before its subtree, earlier siblings (with subtrees) first. */
    DEPTH_FIRST,
    /** First match in level order: shallowest wins, then lowest sibling index. */
    BREADTH_FIRST;

    /** Lenient parse: case-insensitive, '-' and '_' optional ("breadth-first", "BreadthFirst"). */
    public static Optional<SearchOrder> parse(String text) {
        if (text == null) return Optional.empty();
        String squashed = text.trim().replace("-", "").replace("_", "").toUpperCase(Locale.ROOT);
        for (SearchOrder order : values()) {
            if (order.name().replace("_", "").equals(squashed)) return Optional.of(order);
        }
        return Optional.empty();
    }
}
