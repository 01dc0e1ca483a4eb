package com.textgraph.core.layout;

import com.textgraph.core.model.EdgeType;
import com.textgraph.core.model.NodeShape;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DummyNodeInserterTest {

    private final DummyNodeInserter inserter = new DummyNodeInserter();

    @Test
    void insert_longEdge_splitsIntoChain() {
        LayoutGraph dag = new LayoutGraph(
            List.of(vertex("A"), vertex("B"), vertex("C"), vertex("D")),
            List.of(new LayoutEdge("A", "B", EdgeType.ARROW, null),
                new LayoutEdge("B", "C", EdgeType.ARROW, null),
                new LayoutEdge("A", "D", EdgeType.DOTTED_ARROW, "long"),
                new LayoutEdge("C", "D", EdgeType.ARROW, null)));
        LayerAssignment layering = new LayerAssigner().assign(dag);

        AugmentedGraph augmented = inserter.insert(dag, layering);

        assertThat(augmented.chains()).hasSize(1);
        DummyChain chain = augmented.chainFor(new EdgeKey("A", "D")).orElseThrow();
        assertThat(chain.dummies()).containsExactly("__dummy_0_0", "__dummy_0_1");
        assertThat(augmented.layerOf("__dummy_0_0")).isEqualTo(1);
        assertThat(augmented.layerOf("__dummy_0_1")).isEqualTo(2);
        assertThat(augmented.graph().vertex("__dummy_0_0").isDummy()).isTrue();

        for (LayoutEdge edge : augmented.graph().edges()) {
            assertThat(augmented.layerOf(edge.target()) - augmented.layerOf(edge.source())).isEqualTo(1);
        }
        assertThat(augmented.graph().edges())
            .filteredOn(e -> "long".equals(e.label()))
            .singleElement()
            .satisfies(e -> {
                assertThat(e.source()).isEqualTo("__dummy_0_1");
                assertThat(e.target()).isEqualTo("D");
                assertThat(e.type()).isEqualTo(EdgeType.DOTTED_ARROW);
            });
    }

    @ParameterizedTest
    @ValueSource(longs = {3, 7, 12, 29, 41, 77})
    void insert_randomGraph_everyEdgeSpansOneLayer(long seed) {
        LayoutGraph dag = new CycleRemover().remove(LayoutGraphs.random(seed, 10, 0.25)).dag();
        LayerAssignment layering = new LayerAssigner().assign(dag);

        AugmentedGraph augmented = inserter.insert(dag, layering);

        for (LayoutEdge edge : augmented.graph().edges()) {
            assertThat(augmented.layerOf(edge.target()) - augmented.layerOf(edge.source()))
                .as("span of %s", edge.key())
                .isEqualTo(1);
        }
        for (String id : dag.vertexIds()) {
            assertThat(augmented.layerOf(id)).isEqualTo(layering.layerOf(id));
            assertThat(augmented.graph().vertex(id).isDummy()).isFalse();
        }
        for (DummyChain chain : augmented.chains()) {
            assertThat(chain.dummies()).allSatisfy(id -> assertThat(dag.contains(id)).isFalse());
        }
    }

    @Test
    void insert_dummyIdTaken_appendsUnderscore() {
        LayoutGraph dag = new LayoutGraph(
            List.of(vertex("A"), vertex("__dummy_0_0"), vertex("C")),
            List.of(new LayoutEdge("A", "__dummy_0_0", EdgeType.ARROW, null),
                new LayoutEdge("__dummy_0_0", "C", EdgeType.ARROW, null),
                new LayoutEdge("A", "C", EdgeType.ARROW, null)));

        AugmentedGraph augmented = inserter.insert(dag, new LayerAssigner().assign(dag));

        assertThat(augmented.chainFor(new EdgeKey("A", "C")).orElseThrow().dummies())
            .containsExactly("__dummy_0_0_");
    }

    @Test
    void insert_edgeNotDescending_throwsIllegalStateException() {
        LayoutGraph dag = LayoutGraphs.of("A->B");
        LayerAssignment flat = new LayerAssignment(Map.of("A", 0, "B", 0), 1);

        assertThatThrownBy(() -> inserter.insert(dag, flat)).isInstanceOf(IllegalStateException.class);
    }

    private static LayoutVertex vertex(String id) {
        return new LayoutVertex(id, id, NodeShape.RECTANGLE, VertexKind.REAL);
    }
}
