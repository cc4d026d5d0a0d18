package com.scenetree.hierarchy.config;

import com.scenetree.hierarchy.HierarchySearch;
import com.scenetree.hierarchy.SearchOrder;

/**
 * Settings for {@link com.scenetree.hierarchy.HierarchyFinder}.
 *
 * @param pathSeparator        placed before every name in a path (non-empty; null means "/")
 * @param defaultOrder         order used when a descendant search names none (null means depth first)
 * @param ancestorMustBeActive whether ancestor searches skip inactive ancestors
 */
public record HierarchySearchConfig(
        String pathSeparator,
        SearchOrder defaultOrder,
        boolean ancestorMustBeActive
) {
    public HierarchySearchConfig {
        if (pathSeparator == null) pathSeparator = HierarchySearch.DEFAULT_SEPARATOR;
        if (defaultOrder == null) defaultOrder = SearchOrder.DEPTH_FIRST;
        if (pathSeparator.isEmpty()) {
            throw new IllegalArgumentException("pathSeparator must not be empty");
        }
    }

    public static HierarchySearchConfig defaults() {
        return new HierarchySearchConfig(HierarchySearch.DEFAULT_SEPARATOR, SearchOrder.DEPTH_FIRST, false);
    }

    public HierarchySearchConfig withDefaultOrder(SearchOrder order) {
        return new HierarchySearchConfig(pathSeparator, order, ancestorMustBeActive);
    }

    public HierarchySearchConfig withAncestorMustBeActive(boolean mustBeActive) {
        return new HierarchySearchConfig(pathSeparator, defaultOrder, mustBeActive);
    }
}
