package com.textgraph.core.layout;

import com.textgraph.core.model.NodeShape;

import java.util.Objects;

/**
 * Vertex of a {@link LayoutGraph}.
 *
 * @param id unique id
 * @param label display label, empty for dummies
 * @param shape outline shape
 * @param kind what the vertex stands for
 */
public record LayoutVertex(String id, String label, NodeShape shape, VertexKind kind) {

    /**
     * Compact constructor with validation.
     */
    public LayoutVertex {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (label == null) {
            label = "";
        }
        if (shape == null) {
            shape = NodeShape.RECTANGLE;
        }
    }

    public static LayoutVertex dummy(String id) {
        return new LayoutVertex(id, "", NodeShape.RECTANGLE, VertexKind.DUMMY);
    }

    public boolean isDummy() {
        return kind == VertexKind.DUMMY;
    }
}
