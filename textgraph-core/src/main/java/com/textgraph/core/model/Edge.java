package com.textgraph.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A directed connection between two nodes.
 *
 * @param source source node id
 * @param target target node id
 * @param type connector variant
 * @param label optional label, null when absent
 * @param attributes free-form key/value attributes
 */
public record Edge(
    String source,
    String target,
    EdgeType type,
    String label,
    Map<String, String> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public Edge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (type == null) {
            type = EdgeType.ARROW;
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Creates an unlabelled edge.
     *
     * @param source source id
     * @param target target id
     * @param type connector variant
     * @return new edge
     */
    public static Edge of(String source, String target, EdgeType type) {
        return new Edge(source, target, type, null, Map.of());
    }

    /**
     * Creates a labelled edge.
     *
     * @param source source id
     * @param target target id
     * @param type connector variant
     * @param label edge label
     * @return new edge
     */
    public static Edge labeled(String source, String target, EdgeType type, String label) {
        return new Edge(source, target, type, label, Map.of());
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }
}
