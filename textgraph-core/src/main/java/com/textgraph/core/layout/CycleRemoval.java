package com.textgraph.core.layout;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of {@link CycleRemover#remove(LayoutGraph)}.
 *
 * @param dag acyclic copy of the input with back-edges reversed and self-loops dropped
 * @param backEdges input (source, target) pairs that were reversed or dropped
 * @param ordering vertex ordering the back-edges were derived from
 */
public record CycleRemoval(LayoutGraph dag, Set<EdgeKey> backEdges, List<String> ordering) {

    /**
     * Compact constructor with validation.
     */
    public CycleRemoval {
        Objects.requireNonNull(dag, "dag must not be null");
        backEdges = backEdges == null ? Set.of() : Set.copyOf(backEdges);
        ordering = ordering == null ? List.of() : List.copyOf(ordering);
    }

    public boolean isBackEdge(String source, String target) {
        return backEdges.contains(new EdgeKey(source, target));
    }
}
