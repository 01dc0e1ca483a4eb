package com.textgraph.core.layout;

import java.util.Objects;

/**
 * Ordered (source, target) pair identifying an edge of a layout graph.
 *
 * @param source source vertex id
 * @param target target vertex id
 */
public record EdgeKey(String source, String target) {

    /**
     * Compact constructor with validation.
     */
    public EdgeKey {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    public EdgeKey reversed() {
        return new EdgeKey(target, source);
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
