package com.textgraph.core.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Longest-path layering of an acyclic graph.
 *
 * <p>Every vertex starts on layer 0 and edges are relaxed until nothing changes, so each
 * vertex ends one layer below its deepest predecessor.
 */
public class LayerAssigner {

    private static final Logger log = LoggerFactory.getLogger(LayerAssigner.class);

    /**
     * Assigns layers.
     *
     * @param dag acyclic graph
     * @return layer per vertex
     * @throws IllegalStateException if relaxation does not settle, which means the input has a cycle
     */
    public LayerAssignment assign(LayoutGraph dag) {
        Map<String, Integer> layers = new LinkedHashMap<>();
        for (String id : dag.vertexIds()) {
            layers.put(id, 0);
        }

        int rounds = 0;
        boolean changed = true;
        while (changed) {
            if (rounds++ > dag.size()) {
                throw new IllegalStateException("Layer relaxation did not converge; graph is not acyclic");
            }
            changed = false;
            for (LayoutEdge edge : dag.edges()) {
                int candidate = layers.get(edge.source()) + 1;
                if (layers.get(edge.target()) < candidate) {
                    layers.put(edge.target(), candidate);
                    changed = true;
                }
            }
        }

        int layerCount = layers.values().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
        log.debug("Assigned {} vertices to {} layers", layers.size(), layerCount);
        return new LayerAssignment(layers, layerCount);
    }
}
