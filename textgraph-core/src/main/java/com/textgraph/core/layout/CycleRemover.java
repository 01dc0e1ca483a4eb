package com.textgraph.core.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Breaks cycles with the greedy feedback-arc-set heuristic of Eades, Lin and Smyth.
 *
 * <p>Vertices are peeled off the graph while live degree counters are maintained over the
 * remaining set:
 * <ol>
 *   <li>all sinks are moved to the right-hand sequence, repeatedly, until none remain;</li>
 *   <li>all sources are moved to the left-hand sequence, repeatedly, until none remain;</li>
 *   <li>otherwise the vertex with the largest {@code out - in} goes to the left-hand
 *       sequence (lowest id wins a tie).</li>
 * </ol>
 * The ordering is the left-hand sequence followed by the reversed right-hand one. An edge is a
 * back-edge when its source comes after its target, and self-loops are always back-edges.
 *
 * <p>Scans follow the graph's vertex insertion order, so the result is reproducible for a
 * given input.
 */
public class CycleRemover {

    private static final Logger log = LoggerFactory.getLogger(CycleRemover.class);

    /**
     * Computes the acyclic view of a graph.
     *
     * @param graph graph that may contain cycles and self-loops
     * @return DAG, back-edge set and ordering
     */
    public CycleRemoval remove(LayoutGraph graph) {
        if (graph.isEmpty()) {
            return new CycleRemoval(graph, Set.of(), List.of());
        }

        List<String> ordering = greedyOrdering(graph);
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < ordering.size(); i++) {
            position.put(ordering.get(i), i);
        }

        Set<EdgeKey> backEdges = new LinkedHashSet<>();
        List<LayoutEdge> dagEdges = new ArrayList<>();
        for (LayoutEdge edge : graph.edges()) {
            if (edge.isSelfLoop()) {
                backEdges.add(edge.key());
            } else if (position.get(edge.source()) > position.get(edge.target())) {
                backEdges.add(edge.key());
                dagEdges.add(edge.reversed());
            } else {
                dagEdges.add(edge);
            }
        }

        log.debug("Cycle removal: {} vertices, {} back-edges {}", graph.size(), backEdges.size(), backEdges);
        return new CycleRemoval(new LayoutGraph(graph.vertices(), dagEdges), backEdges, ordering);
    }

    List<String> greedyOrdering(LayoutGraph graph) {
        Set<String> active = new LinkedHashSet<>(graph.vertexIds());
        Map<String, Integer> outDegree = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : active) {
            outDegree.put(id, 0);
            inDegree.put(id, 0);
        }
        for (LayoutEdge edge : graph.edges()) {
            if (edge.isSelfLoop()) {
                continue;
            }
            outDegree.merge(edge.source(), 1, Integer::sum);
            inDegree.merge(edge.target(), 1, Integer::sum);
        }

        List<String> left = new ArrayList<>();
        List<String> right = new ArrayList<>();

        while (!active.isEmpty()) {
            List<String> sinks = collect(active, outDegree);
            while (!sinks.isEmpty()) {
                for (String sink : sinks) {
                    active.remove(sink);
                    right.add(sink);
                    decrement(graph.predecessors(sink), sink, active, outDegree);
                }
                sinks = collect(active, outDegree);
            }

            List<String> sources = collect(active, inDegree);
            while (!sources.isEmpty()) {
                for (String source : sources) {
                    active.remove(source);
                    left.add(source);
                    decrement(graph.successors(source), source, active, inDegree);
                }
                sources = collect(active, inDegree);
            }

            if (!active.isEmpty()) {
                String best = null;
                int bestDelta = Integer.MIN_VALUE;
                for (String id : active) {
                    int delta = outDegree.get(id) - inDegree.get(id);
                    if (delta > bestDelta || (delta == bestDelta && id.compareTo(best) < 0)) {
                        best = id;
                        bestDelta = delta;
                    }
                }
                active.remove(best);
                left.add(best);
                decrement(graph.successors(best), best, active, inDegree);
                decrement(graph.predecessors(best), best, active, outDegree);
            }
        }

        Collections.reverse(right);
        left.addAll(right);
        return left;
    }

    private static List<String> collect(Set<String> active, Map<String, Integer> degree) {
        List<String> result = new ArrayList<>();
        for (String id : active) {
            if (degree.get(id) == 0) {
                result.add(id);
            }
        }
        return result;
    }

    private static void decrement(List<String> neighbours, String removed, Set<String> active,
                                  Map<String, Integer> degree) {
        Set<String> done = new HashSet<>();
        for (String neighbour : neighbours) {
            if (!neighbour.equals(removed) && active.contains(neighbour) && done.add(neighbour)) {
                degree.merge(neighbour, -1, Integer::sum);
            }
        }
    }
}
