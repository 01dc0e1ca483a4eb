package com.textgraph.core.layout;

import com.textgraph.core.layout.routing.WaypointEdgeRouter;
import com.textgraph.core.model.Direction;
import com.textgraph.core.model.Edge;
import com.textgraph.core.model.EdgeType;
import com.textgraph.core.model.Graph;
import com.textgraph.core.model.Group;
import com.textgraph.core.model.Node;
import com.textgraph.core.model.NodeShape;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SugiyamaLayoutEngine} and the geometry it produces.
 */
class SugiyamaLayoutEngineTest {

    private final SugiyamaLayoutEngine engine = new SugiyamaLayoutEngine();

    @Test
    void layout_emptyGraph_returnsEmptyResult() {
        LayoutResult result = engine.layout(Graph.empty());

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.edges()).isEmpty();
    }

    @Test
    void layout_chain_stacksBoxesWithGap() {
        LayoutResult result = engine.layout(chain(Direction.TD));

        LayoutNode a = result.node("A").orElseThrow();
        LayoutNode b = result.node("B").orElseThrow();
        assertThat(a.x()).isZero();
        assertThat(a.y()).isZero();
        assertThat(a.width()).isEqualTo(5);
        assertThat(a.height()).isEqualTo(3);
        assertThat(b.y()).isEqualTo(6);
        assertThat(result.layerCount()).isEqualTo(2);

        RoutedEdge edge = result.edge("A", "B").orElseThrow();
        assertThat(edge.waypoints()).containsExactly(new Point(2, 3), new Point(2, 5));
        assertThat(edge.backEdge()).isFalse();
    }

    @Test
    void layout_leftToRight_placesLayersSideBySide() {
        LayoutResult result = engine.layout(chain(Direction.LR));

        LayoutNode a = result.node("A").orElseThrow();
        LayoutNode b = result.node("B").orElseThrow();
        assertThat(a.y()).isEqualTo(b.y());
        assertThat(b.x()).isEqualTo(9);
        assertThat(result.edge("A", "B").orElseThrow().waypoints())
            .containsExactly(new Point(5, 1), new Point(8, 1));
    }

    @Test
    void layout_twoCycle_backEdgeEndsAboveOriginalTarget() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.of("A", "B", EdgeType.ARROW))
            .edge(Edge.of("B", "A", EdgeType.ARROW))
            .build();

        LayoutResult result = engine.layout(graph);

        RoutedEdge back = result.edge("B", "A").orElseThrow();
        LayoutNode a = result.node("A").orElseThrow();
        assertThat(back.backEdge()).isTrue();
        assertThat(back.waypoints().get(back.waypoints().size() - 1)).isEqualTo(new Point(a.centerX(), a.bottom() + 1));
        assertThat(result.backEdges()).containsExactly(new EdgeKey("B", "A"));
    }

    @Test
    void layout_selfLoop_isNotRouted() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.of("A", "A", EdgeType.ARROW))
            .edge(Edge.of("A", "B", EdgeType.ARROW))
            .build();

        LayoutResult result = engine.layout(graph);

        assertThat(result.edges()).extracting(RoutedEdge::target).containsExactly("B");
    }

    @Test
    void layout_longEdge_excludesDummiesFromResult() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.of("A", "B", EdgeType.ARROW))
            .edge(Edge.of("B", "C", EdgeType.ARROW))
            .edge(Edge.of("A", "C", EdgeType.ARROW))
            .build();

        LayoutResult result = engine.layout(graph);

        assertThat(result.nodes()).extracting(LayoutNode::id).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(result.nodes()).noneMatch(LayoutNode::isDummy);
    }

    @Test
    void layout_multilineLabel_growsBox() {
        Graph graph = Graph.builder(Direction.TD)
            .node(Node.of("A", "first\nsecond", NodeShape.RECTANGLE))
            .build();

        LayoutNode a = engine.layout(graph).node("A").orElseThrow();

        assertThat(a.width()).isEqualTo("second".length() + 4);
        assertThat(a.height()).isEqualTo(4);
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 4, 5, 6, 7, 8})
    void layout_randomGraph_boxesDoNotOverlapAndPathsAreOrthogonal(long seed) {
        for (Direction direction : Direction.values()) {
            for (LayoutResult result : List.of(
                engine.layout(random(seed, direction)),
                new SugiyamaLayoutEngine(2, new WaypointEdgeRouter()).layout(random(seed, direction)))) {
                assertLayoutInvariants(result);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {2, 6, 10, 15, 27, 33, 48, 61})
    void layout_randomGroupedGraph_boxesAreNestedOrDisjoint(long seed) {
        for (Direction direction : Direction.values()) {
            Graph graph = randomGrouped(seed, direction);
            for (LayoutResult result : List.of(
                engine.layout(graph),
                new SugiyamaLayoutEngine(2, new WaypointEdgeRouter()).layout(graph))) {
                assertGroupedLayoutInvariants(result);
                assertThat(result.node(LayoutConstants.COMPOUND_PREFIX + "g0").orElseThrow().isCompound()).isTrue();
                assertThat(result.node(LayoutConstants.COMPOUND_PREFIX + "g3").orElseThrow().isCompound()).isTrue();
            }
        }
    }

    private static void assertGroupedLayoutInvariants(LayoutResult result) {
        List<LayoutNode> nodes = result.nodes();
        for (LayoutNode node : nodes) {
            assertThat(node.x()).isNotNegative();
            assertThat(node.y()).isNotNegative();
            assertThat(node.right()).isLessThan(result.width());
            assertThat(node.bottom()).isLessThan(result.height());
        }
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                LayoutNode p = nodes.get(i);
                LayoutNode q = nodes.get(j);
                if (!(p.overlapsHorizontally(q) && p.overlapsVertically(q))) {
                    continue;
                }
                boolean nested = (p.isCompound() && contains(p, q)) || (q.isCompound() && contains(q, p));
                assertThat(nested).as("%s and %s overlap without nesting", p.id(), q.id()).isTrue();
            }
        }
        for (RoutedEdge edge : result.edges()) {
            List<Point> points = edge.waypoints();
            assertThat(points).isNotEmpty();
            for (int k = 1; k < points.size(); k++) {
                assertThat(points.get(k).isAlignedWith(points.get(k - 1))).isTrue();
            }
        }
    }

    private static boolean contains(LayoutNode outer, LayoutNode inner) {
        return outer.x() <= inner.x() && inner.right() <= outer.right()
            && outer.y() <= inner.y() && inner.bottom() <= outer.bottom();
    }

    private static void assertLayoutInvariants(LayoutResult result) {
        List<LayoutNode> nodes = result.nodes();
        for (LayoutNode node : nodes) {
            assertThat(node.x()).isNotNegative();
            assertThat(node.y()).isNotNegative();
        }
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                LayoutNode p = nodes.get(i);
                LayoutNode q = nodes.get(j);
                boolean overlap = p.overlapsHorizontally(q) && p.overlapsVertically(q);
                assertThat(overlap).as("%s overlaps %s", p.id(), q.id()).isFalse();
            }
        }
        for (RoutedEdge edge : result.edges()) {
            List<Point> points = edge.waypoints();
            assertThat(points).isNotEmpty();
            for (int k = 1; k < points.size(); k++) {
                assertThat(points.get(k)).isNotEqualTo(points.get(k - 1));
                assertThat(points.get(k).isAlignedWith(points.get(k - 1))).isTrue();
            }
        }
    }

    private static Graph chain(Direction direction) {
        return Graph.builder(direction).edge(Edge.of("A", "B", EdgeType.ARROW)).build();
    }

    private static Graph random(long seed, Direction direction) {
        Random random = new Random(seed);
        Graph.Builder builder = Graph.builder(direction);
        int size = 3 + random.nextInt(7);
        for (int i = 0; i < size; i++) {
            builder.node(Node.of("n" + i, "node " + i, NodeShape.values()[random.nextInt(4)]));
        }
        for (int s = 0; s < size; s++) {
            for (int t = 0; t < size; t++) {
                if (random.nextDouble() < 0.2) {
                    builder.edge(Edge.of("n" + s, "n" + t, EdgeType.values()[random.nextInt(9)]));
                }
            }
        }
        return builder.build();
    }

    /**
     * Random graph with a nested group, a group sharing members with another, an empty group
     * and edges that end on group names.
     */
    private static Graph randomGrouped(long seed, Direction direction) {
        Random random = new Random(seed);
        Graph.Builder builder = Graph.builder(direction);
        int size = 4 + random.nextInt(6);
        for (int i = 0; i < size; i++) {
            builder.node(Node.of("n" + i, "node " + i, NodeShape.values()[random.nextInt(4)]));
        }
        for (int s = 0; s < size; s++) {
            for (int t = 0; t < size; t++) {
                if (random.nextDouble() < 0.15) {
                    builder.edge(Edge.of("n" + s, "n" + t, EdgeType.values()[random.nextInt(9)]));
                }
            }
        }
        builder.edge(Edge.of("n" + random.nextInt(size), "g0", EdgeType.ARROW));
        builder.edge(Edge.of("g2", "n" + random.nextInt(size), EdgeType.DOTTED_ARROW));
        builder.edge(Edge.of("g3", "g0", EdgeType.LINE));

        builder.group(Group.of("g0", randomMembers(random, size)));
        Group inner = Group.of("g2", randomMembers(random, size));
        builder.group(new Group("g1", randomMembers(random, size), List.of(inner), "outer"));
        builder.group(Group.of("g3", List.of()));
        return builder.build();
    }

    private static List<String> randomMembers(Random random, int size) {
        List<String> members = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (random.nextDouble() < 0.35) {
                members.add("n" + i);
            }
        }
        return members;
    }
}
