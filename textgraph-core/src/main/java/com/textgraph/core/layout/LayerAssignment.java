package com.textgraph.core.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer index per vertex.
 *
 * @param layers layer per vertex id, in vertex order
 * @param layerCount highest layer plus one, or 1 for an empty graph
 */
public record LayerAssignment(Map<String, Integer> layers, int layerCount) {

    /**
     * Compact constructor with validation.
     */
    public LayerAssignment {
        layers = layers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(layers));
        if (layerCount < 1) {
            throw new IllegalArgumentException("layerCount must be >= 1");
        }
    }

    /**
     * Returns the layer of a vertex.
     *
     * @param id vertex id
     * @return layer index
     * @throws IllegalStateException if the vertex was never assigned
     */
    public int layerOf(String id) {
        Integer layer = layers.get(id);
        if (layer == null) {
            throw new IllegalStateException("No layer assigned to vertex: " + id);
        }
        return layer;
    }

    /**
     * Groups vertex ids by layer, keeping vertex order inside each layer.
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
