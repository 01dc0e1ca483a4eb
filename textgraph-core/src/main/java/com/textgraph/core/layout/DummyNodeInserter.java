package com.textgraph.core.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits edges spanning more than one layer into chains of single-layer segments.
 *
 * <p>An edge crossing {@code k} layers gets {@code k - 1} dummy vertices named
 * {@code __dummy_<edge>_<step>}. Only the last segment keeps the edge label, so the label is
 * drawn once, next to the target.
 */
public class DummyNodeInserter {

    private static final Logger log = LoggerFactory.getLogger(DummyNodeInserter.class);

    /**
     * Inserts dummy vertices.
     *
     * @param dag acyclic graph
     * @param layering layers of the DAG vertices
     * @return augmented graph
     * @throws IllegalStateException if an edge does not point to a deeper layer
     */
    public AugmentedGraph insert(LayoutGraph dag, LayerAssignment layering) {
        List<LayoutVertex> vertices = new ArrayList<>(dag.vertices());
        Set<String> usedIds = new HashSet<>(dag.vertexIds());
        Map<String, Integer> layers = new LinkedHashMap<>();
        for (String id : dag.vertexIds()) {
            layers.put(id, layering.layerOf(id));
        }

        List<LayoutEdge> edges = new ArrayList<>();
        List<DummyChain> chains = new ArrayList<>();
        int edgeSeq = 0;

        for (LayoutEdge edge : dag.edges()) {
            int sourceLayer = layers.get(edge.source());
            int targetLayer = layers.get(edge.target());
            int span = targetLayer - sourceLayer;
            if (span < 1) {
                throw new IllegalStateException("Edge " + edge.key() + " does not descend: layers "
                    + sourceLayer + " -> " + targetLayer);
            }
            if (span == 1) {
                edges.add(edge);
                continue;
            }

            int seq = edgeSeq++;
            List<String> dummies = new ArrayList<>();
            String previous = edge.source();
            for (int step = 0; step < span - 1; step++) {
                String id = uniqueId(LayoutConstants.DUMMY_PREFIX + seq + "_" + step, usedIds);
                vertices.add(LayoutVertex.dummy(id));
                layers.put(id, sourceLayer + step + 1);
                dummies.add(id);
                edges.add(new LayoutEdge(previous, id, edge.type(), null));
                previous = id;
            }
            edges.add(new LayoutEdge(previous, edge.target(), edge.type(), edge.label()));
            chains.add(new DummyChain(edge.key(), dummies));
        }

        int layerCount = layers.values().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
        log.debug("Inserted dummies for {} long edges", chains.size());
        return new AugmentedGraph(new LayoutGraph(vertices, edges), layers, layerCount, chains);
    }

    private static String uniqueId(String candidate, Set<String> usedIds) {
        String id = candidate;
        while (!usedIds.add(id)) {
            id = id + "_";
        }
        return id;
    }
}
