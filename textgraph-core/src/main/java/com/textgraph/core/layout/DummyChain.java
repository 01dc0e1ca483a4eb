package com.textgraph.core.layout;

import java.util.List;
import java.util.Objects;

/**
 * Dummy vertices inserted along one multi-layer DAG edge, from source side to target side.
 *
 * @param edge the DAG edge that was split
 * @param dummies dummy vertex ids in layer order
 */
public record DummyChain(EdgeKey edge, List<String> dummies) {

    /**
     * Compact constructor with validation.
     */
    public DummyChain {
        Objects.requireNonNull(edge, "edge must not be null");
        dummies = dummies == null ? List.of() : List.copyOf(dummies);
    }
}
