package com.textgraph.core.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Layered graph in which every edge spans exactly one layer.
 *
 * @param graph DAG with dummy vertices and segment edges
 * @param layers layer per vertex, dummies included
 * @param layerCount number of layers
 * @param chains one entry per split edge
 */
public record AugmentedGraph(
    LayoutGraph graph,
    Map<String, Integer> layers,
    int layerCount,
    List<DummyChain> chains
) {
    /**
     * Compact constructor with validation.
     */
    public AugmentedGraph {
        Objects.requireNonNull(graph, "graph must not be null");
        layers = layers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(layers));
        chains = chains == null ? List.of() : List.copyOf(chains);
    }

    public int layerOf(String id) {
        Integer layer = layers.get(id);
        if (layer == null) {
            throw new IllegalStateException("No layer assigned to vertex: " + id);
        }
        return layer;
    }

    /**
     * Finds the chain inserted for a DAG edge.
     *
     * @param edge DAG edge
     * @return chain, or empty when the edge spans a single layer
     */
    public Optional<DummyChain> chainFor(EdgeKey edge) {
        return chains.stream().filter(c -> c.edge().equals(edge)).findFirst();
    }

    /**
     * Groups vertex ids by layer in vertex order.
     *
     * @return one list per layer
     */
    public List<List<String>> byLayer() {
        List<List<String>> result = new ArrayList<>();
        for (int i = 0; i < layerCount; i++) {
            result.add(new ArrayList<>());
        }
        layers.forEach((id, layer) -> result.get(layer).add(id));
        return result;
    }
}
