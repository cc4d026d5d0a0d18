package com.scenetree.hierarchy;

import java.util.Objects;

/**
 * One search to run from a start node, e.g. "child named Square5, breadth first, active only".
 *
 * @param description  used in report lines
 * @param target       which way to search
 * @param match        what {@code value} is compared against
 * @param value        the name or tag to look for
 * @param mustBeActive only active nodes qualify (descendant searches; ancestors follow the finder's config)
 * @param order        descendant order; null means the finder's default
 */
public record HierarchyQuery(
        String description,
        Target target,
        Match match,
        String value,
        boolean mustBeActive,
        SearchOrder order
) {
    public enum Target {DESCENDANT, DESCENDANTS, ANCESTOR}

    public enum Match {NAME, TAG}

    public HierarchyQuery {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(value, "value");
    }

    public static HierarchyQuery descendantByName(String description, String name, boolean mustBeActive, SearchOrder order) {
        return new HierarchyQuery(description, Target.DESCENDANT, Match.NAME, name, mustBeActive, order);
    }

    public static HierarchyQuery descendantByTag(String description, String tag, boolean mustBeActive, SearchOrder order) {
        return new HierarchyQuery(description, Target.DESCENDANT, Match.TAG, tag, mustBeActive, order);
    }

    public static HierarchyQuery descendantsByName(String description, String name, boolean mustBeActive) {
        return new HierarchyQuery(description, Target.DESCENDANTS, Match.NAME, name, mustBeActive, null);
    }

    public static HierarchyQuery descendantsByTag(String description, String tag, boolean mustBeActive) {
        return new HierarchyQuery(description, Target.DESCENDANTS, Match.TAG, tag, mustBeActive, null);
    }

    public static HierarchyQuery ancestorByName(String description, String name) {
        return new HierarchyQuery(description, Target.ANCESTOR, Match.NAME, name, false, null);
    }

    public static HierarchyQuery ancestorByTag(String description, String tag) {
        return new HierarchyQuery(description, Target.ANCESTOR, Match.TAG, tag, false, null);
    }
}
