package com.textgraph.core.layout;

import com.textgraph.core.model.NodeShape;

import java.util.Objects;

/**
 * A placed box.
 *
 * @param id vertex id, a node id or a synthetic id
 * @param label display label
 * @param shape outline shape
 * @param kind real node, dummy or group box
 * @param layer layer index
 * @param order position inside the layer
 * @param x left column
 * @param y top row
 * @param width columns
 * @param height rows
 * @param description group description, null for anything else
 */
public record LayoutNode(
    String id,
    String label,
    NodeShape shape,
    VertexKind kind,
    int layer,
    int order,
    int x,
    int y,
    int width,
    int height,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public LayoutNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (label == null) {
            label = "";
        }
        if (shape == null) {
            shape = NodeShape.RECTANGLE;
        }
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Negative position for " + id + ": (" + x + ", " + y + ")");
        }
    }

    public int right() {
        return x + width - 1;
    }

    public int bottom() {
        return y + height - 1;
    }

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }

    public boolean isDummy() {
        return kind == VertexKind.DUMMY;
    }

    public boolean isCompound() {
        return kind == VertexKind.COMPOUND;
    }

    /**
     * Returns whether the column ranges of two boxes intersect.
     *
     * @param other other box
     * @return true when the boxes share at least one column
     */
    public boolean overlapsHorizontally(LayoutNode other) {
        return x <= other.right() && other.x <= right();
    }

    public boolean overlapsVertically(LayoutNode other) {
        return y <= other.bottom() && other.y <= bottom();
    }

    public LayoutNode at(int newX, int newY) {
        return new LayoutNode(id, label, shape, kind, layer, order, newX, newY, width, height, description);
    }

    /**
     * Swaps the roles of the axes.
     *
     * @return box with x and y exchanged and width and height exchanged
     */
    public LayoutNode transposed() {
        return new LayoutNode(id, label, shape, kind, layer, order, y, x, height, width, description);
    }

    public LayoutNode withDescription(String text) {
        return new LayoutNode(id, label, shape, kind, layer, order, x, y, width, height, text);
    }
}
