package com.textgraph.core.layout;

import com.textgraph.core.model.EdgeType;

import java.util.Objects;

/**
 * Edge of a {@link LayoutGraph}.
 *
 * @param source source vertex id
 * @param target target vertex id
 * @param type connector variant of the edge it came from
 * @param label label, or null
 */
public record LayoutEdge(String source, String target, EdgeType type, String label) {

    /**
     * Compact constructor with validation.
     */
    public LayoutEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (type == null) {
            type = EdgeType.ARROW;
        }
    }

    public EdgeKey key() {
        return new EdgeKey(source, target);
    }

    public LayoutEdge reversed() {
        return new LayoutEdge(target, source, type, label);
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }
}
