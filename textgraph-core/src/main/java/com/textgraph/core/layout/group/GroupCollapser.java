package com.textgraph.core.layout.group;

import com.textgraph.core.layout.BoxSize;
import com.textgraph.core.layout.LayoutConstants;
import com.textgraph.core.layout.LayoutEdge;
import com.textgraph.core.layout.LayoutGraph;
import com.textgraph.core.layout.LayoutVertex;
import com.textgraph.core.layout.VertexKind;
import com.textgraph.core.model.Edge;
import com.textgraph.core.model.Graph;
import com.textgraph.core.model.Group;
import com.textgraph.core.model.Node;
import com.textgraph.core.model.NodeShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds each top-level group into a single compound vertex for the outer layout.
 *
 * <p>Members are collected recursively: nested groups become nested compound members sized
 * from their own content. A node listed by several groups stays with the first one met in
 * depth-first order. A node whose id equals a group name stands for that group and gets no
 * box of its own.
 *
 * <p>Edges are redirected to the compound that carries each endpoint. Edges that end up with
 * both endpoints on the same compound are left out of the outer layout, and a repeated
 * (source, target) pair keeps only its first edge.
 */
public class GroupCollapser {

    private static final Logger log = LoggerFactory.getLogger(GroupCollapser.class);

    private final int padding;

    public GroupCollapser(int padding) {
        this.padding = Math.max(0, padding);
    }

    /**
     * Collapses the groups of a graph.
     *
     * @param graph input graph
     * @return outer layout graph plus the data needed to expand it again
     */
    public CollapsedGraph collapse(Graph graph) {
        Map<String, Node> nodes = new LinkedHashMap<>();
        for (Node node : graph.nodes()) {
            nodes.put(node.id(), node);
        }
        Set<String> groupNames = new HashSet<>();
        for (Group group : graph.allGroups()) {
            groupNames.add(group.name());
        }

        Set<String> usedIds = new HashSet<>(nodes.keySet());
        Map<String, String> compoundIds = new HashMap<>();
        for (Group group : graph.allGroups()) {
            compoundIds.computeIfAbsent(group.name(), name -> uniqueId(LayoutConstants.COMPOUND_PREFIX + name, usedIds));
        }

        Map<String, String> layoutIds = new HashMap<>();
        Map<String, String> boxIds = new HashMap<>();
        Map<String, List<String>> enclosing = new HashMap<>();
        Set<String> claimed = new HashSet<>();
        List<CompoundBox> compounds = new ArrayList<>();

        for (Group group : graph.groups()) {
            if (layoutIds.containsKey(group.name())) {
                log.warn("Group '{}' is declared more than once; keeping the first", group.name());
                continue;
            }
            String topId = compoundIds.get(group.name());
            CompoundBox box = buildBox(group, topId, new ArrayList<>(), nodes, groupNames, compoundIds,
                claimed, layoutIds, boxIds, enclosing);
            compounds.add(box);
        }

        for (String id : nodes.keySet()) {
            if (!layoutIds.containsKey(id)) {
                layoutIds.put(id, id);
                boxIds.put(id, id);
                enclosing.put(id, List.of());
            }
        }

        List<LayoutVertex> vertices = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (!claimed.contains(node.id()) && !groupNames.contains(node.id())) {
                vertices.add(new LayoutVertex(node.id(), node.label(), node.shape(), VertexKind.REAL));
            }
        }
        for (CompoundBox compound : compounds) {
            vertices.add(new LayoutVertex(compound.id(), compound.name(), NodeShape.RECTANGLE, VertexKind.COMPOUND));
        }

        List<LayoutEdge> edges = new ArrayList<>();
        int intraGroup = 0;
        for (Edge edge : graph.edges()) {
            String source = resolve(layoutIds, edge.source());
            String target = resolve(layoutIds, edge.target());
            if (source.equals(target) && !edge.isSelfLoop()) {
                intraGroup++;
                continue;
            }
            edges.add(new LayoutEdge(source, target, edge.type(), edge.label()));
        }

        if (!compounds.isEmpty()) {
            log.debug("Collapsed {} groups; {} intra-group edges left out of the outer layout",
                compounds.size(), intraGroup);
        }
        return new CollapsedGraph(new LayoutGraph(vertices, edges), compounds, layoutIds, boxIds, enclosing);
    }

    private CompoundBox buildBox(Group group, String topId, List<String> outer, Map<String, Node> nodes,
                                 Set<String> groupNames, Map<String, String> compoundIds, Set<String> claimed,
                                 Map<String, String> layoutIds, Map<String, String> boxIds,
                                 Map<String, List<String>> enclosing) {
        String id = compoundIds.get(group.name());
        layoutIds.put(group.name(), topId);
        boxIds.put(group.name(), id);
        enclosing.put(id, List.copyOf(outer));

        List<String> inside = new ArrayList<>();
        inside.add(id);
        inside.addAll(outer);

        List<CompoundMember> members = new ArrayList<>();
        for (String memberId : group.members()) {
            if (groupNames.contains(memberId) || !claimed.add(memberId)) {
                continue;
            }
            Node node = nodes.getOrDefault(memberId, Node.placeholder(memberId));
            members.add(new CompoundMember(memberId, node.label(), node.shape(),
                BoxSize.forLabel(node.label(), padding), null));
            layoutIds.put(memberId, topId);
            boxIds.put(memberId, memberId);
            enclosing.put(memberId, List.copyOf(inside));
        }
        for (Group nested : group.groups()) {
            if (boxIds.containsKey(nested.name())) {
                continue;
            }
            CompoundBox box = buildBox(nested, topId, inside, nodes, groupNames, compoundIds, claimed,
                layoutIds, boxIds, enclosing);
            members.add(new CompoundMember(box.id(), box.name(), NodeShape.RECTANGLE, box.size(), box));
        }
        return CompoundBox.of(id, group.name(), group.description(), members);
    }

    private static String resolve(Map<String, String> layoutIds, String id) {
        String resolved = layoutIds.get(id);
        if (resolved == null) {
            throw new IllegalStateException("Edge endpoint is neither a node nor a group: " + id);
        }
        return resolved;
    }

    private static String uniqueId(String candidate, Set<String> usedIds) {
        String id = candidate;
        while (!usedIds.add(id)) {
            id = id + "_";
        }
        return id;
    }
}
