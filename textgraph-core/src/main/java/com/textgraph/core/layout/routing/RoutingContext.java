package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.AugmentedGraph;
import com.textgraph.core.layout.EdgeKey;
import com.textgraph.core.layout.LayoutNode;
import com.textgraph.core.layout.group.CollapsedGraph;
import com.textgraph.core.model.Direction;
import com.textgraph.core.model.Edge;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything an {@link EdgeRouter} needs, in screen space.
 *
 * @param edges edges of the input graph, in declaration order
 * @param placed every placed box keyed by id: nodes, group boxes and dummies
 * @param augmented layered graph the boxes were placed from
 * @param collapsed group collapse result, used to map endpoints to boxes
 * @param backEdges layout-graph pairs reversed by cycle removal
 * @param direction flow direction
 */
public record RoutingContext(
    List<Edge> edges,
    Map<String, LayoutNode> placed,
    AugmentedGraph augmented,
    CollapsedGraph collapsed,
    Set<EdgeKey> backEdges,
    Direction direction
) {
    /**
     * Compact constructor with validation.
     */
    public RoutingContext {
        Objects.requireNonNull(edges, "edges must not be null");
        Objects.requireNonNull(placed, "placed must not be null");
        Objects.requireNonNull(augmented, "augmented must not be null");
        Objects.requireNonNull(collapsed, "collapsed must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        backEdges = backEdges == null ? Set.of() : Set.copyOf(backEdges);
    }
}
