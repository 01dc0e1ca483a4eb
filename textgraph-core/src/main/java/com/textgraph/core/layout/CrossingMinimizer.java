package com.textgraph.core.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders the vertices of each layer with alternating barycenter sweeps.
 *
 * <p>Layers start sorted by vertex id. Each pass sorts layers top to bottom by the mean
 * position of their predecessors, then bottom to top by the mean position of their
 * successors. Vertices without a positioned neighbour keep their relative order at the end of
 * the layer. Sweeping stops at the first pass that does not reduce the crossing count and the
 * best ordering seen so far is returned.
 */
public class CrossingMinimizer {

    private static final Logger log = LoggerFactory.getLogger(CrossingMinimizer.class);

    private final int maxPasses;

    public CrossingMinimizer() {
        this(LayoutConstants.MAX_ORDERING_PASSES);
    }

    public CrossingMinimizer(int maxPasses) {
        if (maxPasses < 0) {
            throw new IllegalArgumentException("maxPasses must be >= 0");
        }
        this.maxPasses = maxPasses;
    }

    /**
     * Computes the per-layer vertex order.
     *
     * @param augmented graph whose edges all span one layer
     * @return vertex ids per layer, top layer first
     */
    public List<List<String>> minimize(AugmentedGraph augmented) {
        List<List<String>> ordering = initialOrdering(augmented);
        LayoutGraph graph = augmented.graph();

        List<List<String>> best = copy(ordering);
        int bestCrossings = countCrossings(ordering, graph);
        int initialCrossings = bestCrossings;

        for (int pass = 0; pass < maxPasses && bestCrossings > 0; pass++) {
            for (int layer = 1; layer < ordering.size(); layer++) {
                sortByBarycenter(ordering.get(layer), positions(ordering.get(layer - 1)), graph, true);
            }
            for (int layer = ordering.size() - 2; layer >= 0; layer--) {
                sortByBarycenter(ordering.get(layer), positions(ordering.get(layer + 1)), graph, false);
            }

            int crossings = countCrossings(ordering, graph);
            if (crossings >= bestCrossings) {
                break;
            }
            bestCrossings = crossings;
            best = copy(ordering);
        }

        log.debug("Crossing minimization: {} -> {} crossings", initialCrossings, bestCrossings);
        return best;
    }

    /**
     * Builds the starting order: each layer sorted by vertex id.
     *
     * @param augmented layered graph
     * @return mutable per-layer lists
     */
    public static List<List<String>> initialOrdering(AugmentedGraph augmented) {
        List<List<String>> ordering = augmented.byLayer();
        for (List<String> layer : ordering) {
            Collections.sort(layer);
        }
        return ordering;
    }

    /**
     * Counts pairwise crossings of straight edges between adjacent layers.
     *
     * @param ordering vertex ids per layer
     * @param graph graph whose edges go from layer {@code i} to layer {@code i + 1}
     * @return number of inverted edge pairs summed over all adjacent layer pairs
     */
    public static int countCrossings(List<List<String>> ordering, LayoutGraph graph) {
        int total = 0;
        for (int layer = 0; layer + 1 < ordering.size(); layer++) {
            Map<String, Integer> lower = positions(ordering.get(layer + 1));
            List<int[]> pairs = new ArrayList<>();
            List<String> upper = ordering.get(layer);
            for (int i = 0; i < upper.size(); i++) {
                for (String successor : graph.successors(upper.get(i))) {
                    Integer j = lower.get(successor);
                    if (j != null) {
                        pairs.add(new int[] {i, j});
                    }
                }
            }
            for (int a = 0; a < pairs.size(); a++) {
                for (int b = a + 1; b < pairs.size(); b++) {
                    int[] p = pairs.get(a);
                    int[] q = pairs.get(b);
                    if ((p[0] < q[0] && p[1] > q[1]) || (p[0] > q[0] && p[1] < q[1])) {
                        total++;
                    }
                }
            }
        }
        return total;
    }

    private static void sortByBarycenter(List<String> layer, Map<String, Integer> neighbourPositions,
                                         LayoutGraph graph, boolean usePredecessors) {
        Map<String, Double> keys = new HashMap<>();
        for (String id : layer) {
            List<String> neighbours = usePredecessors ? graph.predecessors(id) : graph.successors(id);
            double sum = 0;
            int count = 0;
            for (String neighbour : neighbours) {
                Integer pos = neighbourPositions.get(neighbour);
                if (pos != null) {
                    sum += pos;
                    count++;
                }
            }
            keys.put(id, count == 0 ? Double.POSITIVE_INFINITY : sum / count);
        }
        layer.sort(Comparator.comparingDouble(keys::get));
    }

    private static Map<String, Integer> positions(List<String> layer) {
        Map<String, Integer> result = new HashMap<>();
        for (int i = 0; i < layer.size(); i++) {
            result.put(layer.get(i), i);
        }
        return result;
    }

    private static List<List<String>> copy(List<List<String>> ordering) {
        List<List<String>> result = new ArrayList<>();
        for (List<String> layer : ordering) {
            result.add(new ArrayList<>(layer));
        }
        return result;
    }
}
