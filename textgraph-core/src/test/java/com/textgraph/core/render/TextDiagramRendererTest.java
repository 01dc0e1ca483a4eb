package com.textgraph.core.render;

import com.textgraph.core.layout.LayoutResult;
import com.textgraph.core.layout.SugiyamaLayoutEngine;
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
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Scenario tests for {@link TextDiagramRenderer} over full layouts.
 */
class TextDiagramRendererTest {

    private static String render(Graph graph, CharPalette palette) {
        LayoutResult layout = new SugiyamaLayoutEngine().layout(graph);
        return new TextDiagramRenderer(palette).render(layout);
    }

    private static Graph chain(Direction direction) {
        return Graph.builder(direction).edge(Edge.of("A", "B", EdgeType.ARROW)).build();
    }

    @Test
    void render_emptyGraph_returnsEmptyString() {
        assertThat(render(Graph.empty(), CharPalette.UNICODE)).isEmpty();
    }

    @Test
    void render_chain_drawsTwoBoxesAndArrow() {
        String expected = String.join("\n",
            "┌───┐",
            "│ A │",
            "└───┘",
            "  │",
            "  │",
            "  ▼",
            "┌───┐",
            "│ B │",
            "└───┘") + "\n";

        assertThat(render(chain(Direction.TD), CharPalette.UNICODE)).isEqualTo(expected);
    }

    @Test
    void render_chainAscii_usesOnlyAscii() {
        String expected = String.join("\n",
            "+---+",
            "| A |",
            "+---+",
            "  |",
            "  |",
            "  v",
            "+---+",
            "| B |",
            "+---+") + "\n";

        String text = render(chain(Direction.TD), CharPalette.ASCII);

        assertThat(text).isEqualTo(expected);
        assertThat(text.chars()).allMatch(c -> c < 128);
    }

    @Test
    void render_bottomToTop_flipsVerticallyWithReadableLabels() {
        String expected = String.join("\n",
            "┌───┐",
            "│ B │",
            "└───┘",
            "  ▲",
            "  │",
            "  │",
            "┌───┐",
            "│ A │",
            "└───┘") + "\n";

        assertThat(render(chain(Direction.BT), CharPalette.UNICODE)).isEqualTo(expected);
    }

    @Test
    void render_leftToRight_arrowPointsRight() {
        String expected = String.join("\n",
            "┌───┐    ┌───┐",
            "│ A │───►│ B │",
            "└───┘    └───┘") + "\n";

        assertThat(render(chain(Direction.LR), CharPalette.UNICODE)).isEqualTo(expected);
    }

    @Test
    void render_rightToLeft_mirrorsWithReadableLabels() {
        String expected = String.join("\n",
            "┌───┐    ┌───┐",
            "│ B │◄───│ A │",
            "└───┘    └───┘") + "\n";

        assertThat(render(chain(Direction.RL), CharPalette.UNICODE)).isEqualTo(expected);
    }

    @Test
    void render_twoCycle_hasArrowheadsBothWays() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.of("A", "B", EdgeType.ARROW))
            .edge(Edge.of("B", "A", EdgeType.ARROW))
            .build();

        List<String> lines = lines(render(graph, CharPalette.UNICODE));

        assertThat(lines.get(3)).isEqualTo("  ▲");
        assertThat(lines.get(5)).isEqualTo("  ▼");
    }

    @Test
    void render_edgeLabel_sitsAboveArrowhead() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.labeled("A", "B", EdgeType.ARROW, "yes"))
            .build();

        List<String> lines = lines(render(graph, CharPalette.UNICODE));

        assertThat(lines.get(4)).isEqualTo("  yes");
        assertThat(lines.get(5)).isEqualTo("  ▼");
    }

    @Test
    void render_edgeLabelLeftToRight_staysInGapAboveLine() {
        Graph graph = Graph.builder(Direction.LR)
            .edge(Edge.labeled("A", "B", EdgeType.ARROW, "lbl"))
            .build();

        List<String> lines = lines(render(graph, CharPalette.UNICODE));

        assertThat(lines.get(0)).startsWith("┌───┐").endsWith("┌───┐").contains("lbl").hasSize(14);
        assertThat(lines.get(1)).isEqualTo("│ A │───►│ B │");
        assertThat(lines.get(2)).isEqualTo("└───┘    └───┘");
    }

    @Test
    void render_edgeLabelRightToLeft_keepsTargetCornerIntact() {
        Graph graph = Graph.builder(Direction.RL)
            .edge(Edge.labeled("A", "B", EdgeType.ARROW, "lbl"))
            .build();

        List<String> lines = lines(render(graph, CharPalette.UNICODE));

        assertThat(lines.get(0)).startsWith("┌───┐").endsWith("┌───┐").contains("lbl").hasSize(14);
        assertThat(lines.get(1)).isEqualTo("│ B │◄───│ A │");
    }

    @Test
    void render_twoLabelsOnOneRow_doNotOverwriteEachOther() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.labeled("A", "B", EdgeType.ARROW, "left"))
            .edge(Edge.labeled("A", "C", EdgeType.ARROW, "right"))
            .build();

        String text = render(graph, CharPalette.UNICODE);

        assertThat(text).contains("left", "right");
    }

    @Test
    void render_diamondGraph_joinsBranchesWithCornersAndTees() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.of("A", "B", EdgeType.ARROW))
            .edge(Edge.of("A", "C", EdgeType.ARROW))
            .edge(Edge.of("B", "D", EdgeType.ARROW))
            .edge(Edge.of("C", "D", EdgeType.ARROW))
            .build();
        String expected = String.join("\n",
            "    ┌───┐",
            "    │ A │",
            "    └───┘",
            "      │",
            "  ┌───┴────┐",
            "  ▼        ▼",
            "┌───┐    ┌───┐",
            "│ B │    │ C │",
            "└───┘    └───┘",
            "  │        │",
            "  └───┬────┘",
            "      ▼",
            "    ┌───┐",
            "    │ D │",
            "    └───┘") + "\n";

        String text = render(graph, CharPalette.UNICODE);

        assertThat(text).isEqualTo(expected);
        assertThat(text).doesNotContain("┼", "├", "┤");
    }

    @Test
    void render_group_drawsBorderTitleAndInnerEdge() {
        Graph graph = Graph.builder(Direction.TD)
            .edge(Edge.of("X", "Y", EdgeType.ARROW))
            .group(Group.of("G", List.of("X", "Y")))
            .build();

        List<String> lines = lines(render(graph, CharPalette.UNICODE));

        assertThat(lines).hasSize(7);
        assertThat(lines.get(0)).isEqualTo("┌───────────────┐");
        assertThat(lines.get(1)).isEqualTo("│       G       │");
        assertThat(lines.get(4)).isEqualTo("│ │ X │──►│ Y │ │");
        assertThat(lines.get(6)).isEqualTo("└───────────────┘");
    }

    @Test
    void render_groupDescription_writtenAboveBottomBorder() {
        Graph graph = Graph.builder(Direction.TD)
            .group(new Group("G", List.of("X"), List.of(), "about"))
            .build();

        List<String> lines = lines(render(graph, CharPalette.UNICODE));

        assertThat(lines.get(lines.size() - 2)).contains("about");
        assertThat(lines.get(lines.size() - 1)).startsWith("└");
    }

    @Test
    void render_shapes_useShapeCorners() {
        Graph graph = Graph.builder(Direction.LR)
            .node(Node.of("R", "R", NodeShape.ROUNDED))
            .node(Node.of("D", "D", NodeShape.DIAMOND))
            .node(Node.of("C", "C", NodeShape.CIRCLE))
            .build();

        String text = render(graph, CharPalette.UNICODE);

        assertThat(text).contains("╭───╮", "/───\\", "(───)");
    }

    @Test
    void render_dottedAndThickEdges_useStyledLines() {
        Graph dotted = Graph.builder(Direction.TD).edge(Edge.of("A", "B", EdgeType.DOTTED_ARROW)).build();
        Graph thick = Graph.builder(Direction.TD).edge(Edge.of("A", "B", EdgeType.THICK_LINE)).build();

        assertThat(lines(render(dotted, CharPalette.UNICODE)).get(4)).isEqualTo("  ╎");
        assertThat(lines(render(thick, CharPalette.UNICODE)).get(5)).isEqualTo("  ║");
    }

    @Test
    void render_bidirectional_arrowheadsAtBothEnds() {
        Graph graph = Graph.builder(Direction.TD).edge(Edge.of("A", "B", EdgeType.BIDIR_ARROW)).build();

        List<String> lines = lines(render(graph, CharPalette.UNICODE));

        assertThat(lines.get(3)).isEqualTo("  ▲");
        assertThat(lines.get(5)).isEqualTo("  ▼");
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n"));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 4, 9, 14, 22, 35, 50, 71})
    void render_randomGraph_eachPaletteKeepsToItsOwnGlyphs(long seed) {
        for (Direction direction : Direction.values()) {
            LayoutResult layout = new SugiyamaLayoutEngine().layout(randomGraph(seed, direction));

            String unicode = new TextDiagramRenderer(CharPalette.UNICODE).render(layout);
            String ascii = new TextDiagramRenderer(CharPalette.ASCII).render(layout);

            assertThat(unicode).contains("─").doesNotContain("+", "|", "-");
            assertThat(ascii.chars()).allSatisfy(c -> assertThat(c).isLessThan(128));
            assertThat(ascii).contains("+", "-");
            assertThat(ascii.lines().count()).isEqualTo(unicode.lines().count());
        }
    }

    private static Graph randomGraph(long seed, Direction direction) {
        Random random = new Random(seed);
        Graph.Builder builder = Graph.builder(direction);
        int size = 3 + random.nextInt(6);
        for (int i = 0; i < size; i++) {
            builder.node(Node.of("n" + i, "node " + i, NodeShape.values()[random.nextInt(4)]));
        }
        for (int s = 0; s < size; s++) {
            for (int t = 0; t < size; t++) {
                if (random.nextDouble() < 0.2) {
                    builder.edge(Edge.of("n" + s, "n" + t, EdgeType.values()[random.nextInt(EdgeType.values().length)]));
                }
            }
        }
        List<String> members = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (random.nextBoolean()) {
                members.add("n" + i);
            }
        }
        builder.group(Group.of("grp", members));
        return builder.build();
    }
}
