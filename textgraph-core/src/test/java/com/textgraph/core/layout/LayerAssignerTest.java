package com.textgraph.core.layout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class LayerAssignerTest {

    private final LayerAssigner assigner = new LayerAssigner();

    @Test
    void assign_chain_oneLayerPerVertex() {
        LayerAssignment layering = assigner.assign(LayoutGraphs.of("A->B", "B->C"));

        assertThat(layering.layerOf("A")).isZero();
        assertThat(layering.layerOf("B")).isEqualTo(1);
        assertThat(layering.layerOf("C")).isEqualTo(2);
        assertThat(layering.layerCount()).isEqualTo(3);
    }

    @Test
    void assign_shortcut_usesLongestPath() {
        LayerAssignment layering = assigner.assign(LayoutGraphs.of("A->C", "A->B", "B->C"));

        assertThat(layering.layerOf("C")).isEqualTo(2);
        assertThat(layering.byLayer()).containsExactly(
            java.util.List.of("A"), java.util.List.of("B"), java.util.List.of("C"));
    }

    @Test
    void assign_emptyGraph_hasOneLayer() {
        assertThat(assigner.assign(LayoutGraphs.of()).layerCount()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(longs = {7, 11, 19, 23})
    void assign_randomDag_everyEdgeDescends(long seed) {
        LayoutGraph dag = new CycleRemover().remove(LayoutGraphs.random(seed, 10, 0.2)).dag();

        LayerAssignment layering = assigner.assign(dag);

        for (LayoutEdge edge : dag.edges()) {
            assertThat(layering.layerOf(edge.target())).isGreaterThan(layering.layerOf(edge.source()));
        }
    }
}
