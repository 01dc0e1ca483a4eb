package com.textgraph.core.layout;

import com.textgraph.core.model.Direction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Output of the layout pipeline.
 *
 * <p>Coordinates are in screen orientation for TD and LR. BT and RL diagrams are laid out as
 * TD and LR respectively; the renderer mirrors the painted text.
 *
 * @param nodes node and group boxes, groups before their members; no dummies
 * @param edges routed edges without self-loops
 * @param backEdges outer-layout pairs reversed to break cycles
 * @param direction flow direction
 * @param layerCount number of layers of the outer layout
 */
public record LayoutResult(
    List<LayoutNode> nodes,
    List<RoutedEdge> edges,
    Set<EdgeKey> backEdges,
    Direction direction,
    int layerCount
) {
    /**
     * Compact constructor with validation.
     */
    public LayoutResult {
        Objects.requireNonNull(direction, "direction must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        backEdges = backEdges == null ? Set.of() : Set.copyOf(backEdges);
    }

    public static LayoutResult empty(Direction direction) {
        return new LayoutResult(List.of(), List.of(), Set.of(), direction, 1);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<LayoutNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    /**
     * Finds the first routed edge between two endpoints.
     *
     * @param source source id
     * @param target target id
     * @return routed edge, or empty
     */
    public Optional<RoutedEdge> edge(String source, String target) {
        return edges.stream()
            .filter(e -> e.source().equals(source) && e.target().equals(target))
            .findFirst();
    }

    /**
     * Width of the area covered by boxes and paths.
     *
     * @return columns
     */
    public int width() {
        int width = 0;
        for (LayoutNode node : nodes) {
            width = Math.max(width, node.right() + 1);
        }
        for (RoutedEdge edge : edges) {
            for (Point point : edge.waypoints()) {
                width = Math.max(width, point.x() + 1);
            }
        }
        return width;
    }

    /**
     * Height of the area covered by boxes and paths.
     *
     * @return rows
     */
    public int height() {
        int height = 0;
        for (LayoutNode node : nodes) {
            height = Math.max(height, node.bottom() + 1);
        }
        for (RoutedEdge edge : edges) {
            for (Point point : edge.waypoints()) {
                height = Math.max(height, point.y() + 1);
            }
        }
        return height;
    }
}
