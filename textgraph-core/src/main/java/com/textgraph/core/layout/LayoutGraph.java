package com.textgraph.core.layout;

import com.textgraph.core.model.Edge;
import com.textgraph.core.model.Graph;
import com.textgraph.core.model.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable directed graph passed between layout stages.
 *
 * <p>Vertices keep insertion order and at most one edge exists per ordered (source, target)
 * pair; a repeated pair keeps its first edge. Each stage builds a new instance rather than
 * mutating its input.
 */
public final class LayoutGraph {

    private final Map<String, LayoutVertex> vertices;
    private final List<LayoutEdge> edges;
    private final Map<String, List<String>> successors;
    private final Map<String, List<String>> predecessors;

    /**
     * Creates a layout graph.
     *
     * @param vertices vertices in iteration order
     * @param edges edges; duplicates of an earlier pair are dropped
     * @throws IllegalArgumentException if an edge references an unknown vertex
     */
    public LayoutGraph(Collection<LayoutVertex> vertices, Collection<LayoutEdge> edges) {
        Map<String, LayoutVertex> byId = new LinkedHashMap<>();
        for (LayoutVertex vertex : vertices) {
            if (byId.putIfAbsent(vertex.id(), vertex) != null) {
                throw new IllegalArgumentException("Duplicate vertex id: " + vertex.id());
            }
        }
        Map<String, List<String>> succ = new LinkedHashMap<>();
        Map<String, List<String>> pred = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            succ.put(id, new ArrayList<>());
            pred.put(id, new ArrayList<>());
        }
        List<LayoutEdge> kept = new ArrayList<>();
        Set<EdgeKey> seen = new HashSet<>();
        for (LayoutEdge edge : edges) {
            if (!byId.containsKey(edge.source()) || !byId.containsKey(edge.target())) {
                throw new IllegalArgumentException("Edge references unknown vertex: " + edge.key());
            }
            if (!seen.add(edge.key())) {
                continue;
            }
            kept.add(edge);
            succ.get(edge.source()).add(edge.target());
            pred.get(edge.target()).add(edge.source());
        }
        this.vertices = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(kept);
        this.successors = succ;
        this.predecessors = pred;
    }

    /**
     * Builds a layout graph with one real vertex per node and one edge per distinct pair.
     *
     * @param graph input graph
     * @return layout graph
     */
    public static LayoutGraph from(Graph graph) {
        List<LayoutVertex> vertices = new ArrayList<>();
        for (Node node : graph.nodes()) {
            vertices.add(new LayoutVertex(node.id(), node.label(), node.shape(), VertexKind.REAL));
        }
        List<LayoutEdge> edges = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            edges.add(new LayoutEdge(edge.source(), edge.target(), edge.type(), edge.label()));
        }
        return new LayoutGraph(vertices, edges);
    }

    public Collection<LayoutVertex> vertices() {
        return vertices.values();
    }

    public List<String> vertexIds() {
        return List.copyOf(vertices.keySet());
    }

    public LayoutVertex vertex(String id) {
        return vertices.get(id);
    }

    public boolean contains(String id) {
        return vertices.containsKey(id);
    }

    public List<LayoutEdge> edges() {
        return edges;
    }

    public List<String> successors(String id) {
        return Collections.unmodifiableList(successors.getOrDefault(id, List.of()));
    }

    public List<String> predecessors(String id) {
        return Collections.unmodifiableList(predecessors.getOrDefault(id, List.of()));
    }

    public int size() {
        return vertices.size();
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }
}
