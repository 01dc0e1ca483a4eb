package com.textgraph.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A declared (or placeholder) diagram node.
 *
 * @param id unique identifier
 * @param label display label, may span several lines separated by {@code \n}
 * @param shape outline shape
 * @param group name of the owning group, or null
 * @param attributes free-form key/value attributes
 */
public record Node(
    String id,
    String label,
    NodeShape shape,
    String group,
    Map<String, String> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public Node {
        Objects.requireNonNull(id, "id must not be null");
        if (label == null) {
            label = id;
        }
        if (shape == null) {
            shape = NodeShape.RECTANGLE;
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Creates a node with the given label and shape.
     *
     * @param id identifier
     * @param label display label
     * @param shape outline shape
     * @return new node
     */
    public static Node of(String id, String label, NodeShape shape) {
        return new Node(id, label, shape, null, Map.of());
    }

    /**
     * Creates the placeholder used for an identifier that only appears as an edge endpoint.
     *
     * @param id identifier
     * @return rectangle node labelled with its own id
     */
    public static Node placeholder(String id) {
        return new Node(id, id, NodeShape.RECTANGLE, null, Map.of());
    }

    /**
     * Returns a copy of this node owned by the given group.
     *
     * @param groupName owning group name
     * @return node with the group set
     */
    public Node inGroup(String groupName) {
        return new Node(id, label, shape, groupName, attributes);
    }
}
