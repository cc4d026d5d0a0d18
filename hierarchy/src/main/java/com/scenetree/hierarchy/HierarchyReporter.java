package com.scenetree.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Runs {@link HierarchyQuery}s from a start node and reports the path of everything found. */
public final class HierarchyReporter<N> {
    private static final Logger log = LoggerFactory.getLogger(HierarchyReporter.class);

    private final HierarchyFinder<N> finder;

    public HierarchyReporter(HierarchyFinder<N> finder) {
        this.finder = Objects.requireNonNull(finder, "finder");
    }

    /** One {@code "Found <description>: <path>"} line per node found, in query order. Queries that miss add nothing. */
    public List<String> report(N start, List<HierarchyQuery> queries) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(queries, "queries");
        List<String> lines = new ArrayList<>();
        for (HierarchyQuery query : queries) {
            List<N> found = run(start, query);
            if (found.isEmpty()) {
                log.debug("No match for {} from {}", query.description(), finder.tc().label(start));
            }
            for (N node : found) {
                String path = finder.pathOf(node);
                log.info("Found {}: {}", query.description(), path);
                lines.add("Found " + query.description() + ": " + path);
            }
        }
        return lines;
    }

    List<N> run(N start, HierarchyQuery query) {
        SearchOrder order = query.order() == null ? finder.config().defaultOrder() : query.order();
        boolean byName = query.match() == HierarchyQuery.Match.NAME;
        return switch (query.target()) {
            case DESCENDANT -> asList(byName
                    ? finder.findDescendantByName(start, query.value(), query.mustBeActive(), order)
                    : finder.findDescendantByTag(start, query.value(), query.mustBeActive(), order));
            case DESCENDANTS -> byName
                    ? finder.findDescendantsByName(start, query.value(), query.mustBeActive())
                    : finder.findDescendantsByTag(start, query.value(), query.mustBeActive());
            case ANCESTOR -> asList(byName
                    ? finder.findAncestorByName(start, query.value())
                    : finder.findAncestorByTag(start, query.value()));
        };
    }

    private static <N> List<N> asList(Optional<N> found) {
        return found.isPresent() ? List.of(found.get()) : List.of();
    }
}
