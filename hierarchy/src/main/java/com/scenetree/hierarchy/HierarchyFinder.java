package com.scenetree.hierarchy;

import com.scenetree.hierarchy.config.HierarchySearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Name and tag searches for one kind of host node, bound to a {@link HierarchyTC} and a {@link HierarchySearchConfig}.
 * <p>
 * Each call walks the tree again. Search once during setup and keep the result rather than calling this per frame.
 */
public final class HierarchyFinder<N> {
    private static final Logger log = LoggerFactory.getLogger(HierarchyFinder.class);

    private final HierarchyTC<N> tc;
    private final HierarchySearchConfig config;

    public HierarchyFinder(HierarchyTC<N> tc, HierarchySearchConfig config) {
        this.tc = Objects.requireNonNull(tc, "tc");
        this.config = Objects.requireNonNull(config, "config");
    }

    public HierarchyFinder(HierarchyTC<N> tc) {
        this(tc, HierarchySearchConfig.defaults());
    }

    public HierarchyTC<N> tc() { return tc; }

    public HierarchySearchConfig config() { return config; }

    // --- single descendant ---

    public Optional<N> findDescendantByName(N root, String name, boolean mustBeActive) {
        return findDescendantByName(root, name, mustBeActive, config.defaultOrder());
    }

    public Optional<N> findDescendantByName(N root, String name, boolean mustBeActive, SearchOrder order) {
        return descendant("name", name, root, NodePredicates.named(tc, name), mustBeActive, order);
    }

    /** @throws RuntimeException whatever the host throws for an unregistered tag */
    public Optional<N> findDescendantByTag(N root, String tag, boolean mustBeActive) {
        return findDescendantByTag(root, tag, mustBeActive, config.defaultOrder());
    }

    public Optional<N> findDescendantByTag(N root, String tag, boolean mustBeActive, SearchOrder order) {
        return descendant("tag", tag, root, NodePredicates.tagged(tc, tag), mustBeActive, order);
    }

    // --- all descendants ---

    public List<N> findDescendantsByName(N root, String name, boolean mustBeActive) {
        return descendants("name", name, root, NodePredicates.named(tc, name), mustBeActive);
    }

    public List<N> findDescendantsByTag(N root, String tag, boolean mustBeActive) {
        return descendants("tag", tag, root, NodePredicates.tagged(tc, tag), mustBeActive);
    }

    // --- ancestors ---

    public Optional<N> findAncestorByName(N node, String name) {
        return ancestor("name", name, node, NodePredicates.named(tc, name));
    }

    public Optional<N> findAncestorByTag(N node, String tag) {
        return ancestor("tag", tag, node, NodePredicates.tagged(tc, tag));
    }

    // --- paths ---

    public String pathOf(N node) {
        return HierarchySearch.pathOf(node, config.pathSeparator(), tc);
    }

    private Optional<N> descendant(String by, String value, N root, Predicate<N> predicate, boolean mustBeActive, SearchOrder order) {
        Optional<N> found = HierarchySearch.findDescendant(root, predicate, mustBeActive, order, tc);
        if (log.isDebugEnabled()) {
            log.debug("findDescendant {}={} under {} order={} mustBeActive={} -> {}",
                    by, value, tc.label(root), order, mustBeActive, found.map(this::pathOf).orElse("none"));
        }
        return found;
    }

    private List<N> descendants(String by, String value, N root, Predicate<N> predicate, boolean mustBeActive) {
        List<N> found = HierarchySearch.findDescendants(root, predicate, mustBeActive, tc);
        log.debug("findDescendants {}={} under {} mustBeActive={} -> {} match(es)",
                by, value, tc.label(root), mustBeActive, found.size());
        return found;
    }

    private Optional<N> ancestor(String by, String value, N node, Predicate<N> predicate) {
        Optional<N> found = HierarchySearch.findAncestor(node, predicate, config.ancestorMustBeActive(), tc);
        if (log.isDebugEnabled()) {
            log.debug("findAncestor {}={} above {} mustBeActive={} -> {}",
                    by, value, tc.label(node), config.ancestorMustBeActive(), found.map(this::pathOf).orElse("none"));
        }
        return found;
    }
}
