package com.scenetree.hierarchy;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a host-owned tree, as a typeclass over the host's node type {@code N}.
 * <p>
 * The host keeps its own node objects; an implementation of this interface tells the search
 * code how to read them. Implementations must not mutate the tree when queried.
 */
public interface HierarchyTC<N> {

    /** Children in index order. Must be stable for the duration of a single search. */
    List<N> children(N node);

    /** The parent, or empty for the root. */
    Optional<N> parent(N node);

    String name(N node);

    /** Host-defined activation flag. */
    boolean isActive(N node);

    /**
     * Tag membership. Hosts with a tag registry should throw (for example {@link UnknownTagException})
     * when {@code tag} is not registered; callers see that exception unchanged.
     */
    boolean hasTag(N node, String tag);

    /** Label for logs/tests (defaults to the name). */
    default String label(N node) { return name(node); }
}
