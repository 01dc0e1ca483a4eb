package com.textgraph.core.layout;

import com.textgraph.core.model.EdgeType;

import java.util.List;
import java.util.Objects;

/**
 * An edge with its orthogonal path.
 *
 * <p>Source and target are the edge's own endpoints, so the path always runs from the
 * source box to the target box and the arrowhead lands on the target, also for edges that
 * were reversed to break a cycle.
 *
 * @param source source node id or group name
 * @param target target node id or group name
 * @param type connector variant
 * @param label label, or null
 * @param waypoints path from source to target
 * @param backEdge whether cycle removal reversed this edge for layering
 */
public record RoutedEdge(
    String source,
    String target,
    EdgeType type,
    String label,
    List<Point> waypoints,
    boolean backEdge
) {
    /**
     * Compact constructor with validation.
     */
    public RoutedEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
        for (int i = 1; i < waypoints.size(); i++) {
            if (!waypoints.get(i - 1).isAlignedWith(waypoints.get(i))) {
                throw new IllegalStateException("Diagonal segment in route " + source + "->" + target
                    + ": " + waypoints.get(i - 1) + " to " + waypoints.get(i));
            }
        }
    }

    /**
     * Point the label is anchored to: the middle waypoint.
     *
     * @return label anchor, or null for an empty path
     */
    public Point labelAnchor() {
        return waypoints.isEmpty() ? null : waypoints.get(waypoints.size() / 2);
    }
}
