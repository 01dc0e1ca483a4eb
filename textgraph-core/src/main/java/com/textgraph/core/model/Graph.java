package com.textgraph.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable directed multigraph handed from the parser to the layout pipeline.
 *
 * <p>Nodes keep the order in which they were first mentioned, which is the order every later
 * stage uses to break ties. Build instances with {@link Builder}, which takes care of
 * duplicate declarations and undeclared edge endpoints.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Graph graph = Graph.builder(Direction.TD)
 *     .node(Node.of("A", "Start", NodeShape.ROUNDED))
 *     .edge(Edge.of("A", "B", EdgeType.ARROW))
 *     .build();
 * }</pre>
 *
 * @param direction flow direction
 * @param nodes nodes in first-mention order
 * @param edges edges in declaration order
 * @param groups top-level groups in declaration order
 */
public record Graph(
    Direction direction,
    List<Node> nodes,
    List<Edge> edges,
    List<Group> groups
) {
    /**
     * Compact constructor with validation.
     */
    public Graph {
        if (direction == null) {
            direction = Direction.TD;
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        groups = groups == null ? List.of() : List.copyOf(groups);
        Set<String> seen = new HashSet<>();
        for (Node node : nodes) {
            if (!seen.add(node.id())) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
    }

    /**
     * Creates an empty top-down graph.
     *
     * @return graph without nodes, edges or groups
     */
    public static Graph empty() {
        return new Graph(Direction.TD, List.of(), List.of(), List.of());
    }

    /**
     * Starts a builder for the given direction.
     *
     * @param direction flow direction
     * @return new builder
     */
    public static Builder builder(Direction direction) {
        return new Builder(direction);
    }

    /**
     * Returns a copy of this graph laid out in another direction.
     *
     * @param newDirection direction to use
     * @return graph with the same content
     */
    public Graph withDirection(Direction newDirection) {
        return new Graph(newDirection, nodes, edges, groups);
    }

    /**
     * Looks up a node by id.
     *
     * @param id node id
     * @return the node, or empty when unknown
     */
    public Optional<Node> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public boolean containsNode(String id) {
        return node(id).isPresent();
    }

    /**
     * A graph is empty when it has neither nodes nor groups.
     *
     * @return true if there is nothing to draw
     */
    public boolean isEmpty() {
        return nodes.isEmpty() && groups.isEmpty();
    }

    /**
     * Flattens the group tree depth first, parents before children.
     *
     * @return every group in the graph
     */
    public List<Group> allGroups() {
        List<Group> result = new ArrayList<>();
        Deque<Group> stack = new ArrayDeque<>();
        for (int i = groups.size() - 1; i >= 0; i--) {
            stack.push(groups.get(i));
        }
        while (!stack.isEmpty()) {
            Group group = stack.pop();
            result.add(group);
            List<Group> nested = group.groups();
            for (int i = nested.size() - 1; i >= 0; i--) {
                stack.push(nested.get(i));
            }
        }
        return result;
    }

    public int outDegree(String id) {
        return (int) edges.stream().filter(e -> e.source().equals(id)).count();
    }

    public int inDegree(String id) {
        return (int) edges.stream().filter(e -> e.target().equals(id)).count();
    }

    /**
     * Returns whether the node-to-node edges form no directed cycle. Self-loops count as cycles.
     *
     * @return true for a DAG
     */
    public boolean isAcyclic() {
        return kahnOrder().size() == nodes.size();
    }

    /**
     * Topological order of the nodes, ties broken by first-mention order.
     *
     * @return nodes ids sorted so every edge points forward
     * @throws IllegalStateException if the graph contains a cycle
     */
    public List<String> topologicalOrder() {
        List<String> order = kahnOrder();
        if (order.size() != nodes.size()) {
            throw new IllegalStateException("Graph contains a cycle");
        }
        return order;
    }

    private List<String> kahnOrder() {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (Node node : nodes) {
            indegree.put(node.id(), 0);
            successors.put(node.id(), new ArrayList<>());
        }
        for (Edge edge : edges) {
            if (!indegree.containsKey(edge.source()) || !indegree.containsKey(edge.target())) {
                continue;
            }
            successors.get(edge.source()).add(edge.target());
            indegree.merge(edge.target(), 1, Integer::sum);
        }
        Deque<String> ready = new ArrayDeque<>();
        indegree.forEach((id, deg) -> {
            if (deg == 0) {
                ready.add(id);
            }
        });
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : successors.get(id)) {
                if (indegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return order;
    }

    /**
     * Mutable builder that enforces the graph's identity rules.
     *
     * <ul>
     *   <li>The first declaration of a node id wins; later ones are ignored.</li>
     *   <li>An id that only appears as an edge endpoint gets a placeholder node, unless it
     *       names a group, in which case the edge attaches to the group.</li>
     *   <li>A node listed in several groups belongs to the first one.</li>
     * </ul>
     */
    public static final class Builder {

        private Direction direction;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Set<String> placeholders = new LinkedHashSet<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<Group> groups = new ArrayList<>();

        private Builder(Direction direction) {
            this.direction = direction == null ? Direction.TD : direction;
        }

        public Builder direction(Direction newDirection) {
            this.direction = Objects.requireNonNull(newDirection, "direction must not be null");
            return this;
        }

        /**
         * Declares a node. Ignored if the id was already declared.
         *
         * @param node node to add
         * @return this builder
         */
        public Builder node(Node node) {
            Objects.requireNonNull(node, "node must not be null");
            if (placeholders.remove(node.id())) {
                nodes.put(node.id(), node);
            } else {
                nodes.putIfAbsent(node.id(), node);
            }
            return this;
        }

        /**
         * Adds an edge, creating placeholders for unknown endpoints.
         *
         * @param edge edge to add
         * @return this builder
         */
        public Builder edge(Edge edge) {
            Objects.requireNonNull(edge, "edge must not be null");
            reference(edge.source());
            reference(edge.target());
            edges.add(edge);
            return this;
        }

        /**
         * Adds a top-level group.
         *
         * @param group group to add
         * @return this builder
         */
        public Builder group(Group group) {
            Objects.requireNonNull(group, "group must not be null");
            groups.add(group);
            return this;
        }

        /**
         * Mentions a node id without declaring it. A later {@link #node(Node)} call replaces
         * the placeholder created here.
         *
         * @param id node id
         * @return this builder
         */
        public Builder reference(String id) {
            Objects.requireNonNull(id, "id must not be null");
            if (!nodes.containsKey(id)) {
                nodes.put(id, Node.placeholder(id));
                placeholders.add(id);
            }
            return this;
        }

        /**
         * Builds the immutable graph.
         *
         * @return graph snapshot
         */
        public Graph build() {
            Graph draft = new Graph(direction, List.of(), List.of(), groups);
            Set<String> groupNames = new HashSet<>();
            for (Group group : draft.allGroups()) {
                groupNames.add(group.name());
            }

            Map<String, Node> result = new LinkedHashMap<>();
            for (Map.Entry<String, Node> entry : nodes.entrySet()) {
                String id = entry.getKey();
                if (placeholders.contains(id) && groupNames.contains(id)) {
                    continue;
                }
                result.put(id, entry.getValue());
            }

            Set<String> claimed = new HashSet<>();
            for (Group group : draft.allGroups()) {
                for (String member : group.members()) {
                    if (groupNames.contains(member) && !result.containsKey(member)) {
                        continue;
                    }
                    if (!claimed.add(member)) {
                        continue;
                    }
                    Node node = result.get(member);
                    if (node == null) {
                        node = Node.placeholder(member);
                    }
                    result.put(member, node.group() == null ? node.inGroup(group.name()) : node);
                }
            }
            return new Graph(direction, new ArrayList<>(result.values()), edges, groups);
        }
    }
}
