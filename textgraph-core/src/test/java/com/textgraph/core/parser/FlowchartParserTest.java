package com.textgraph.core.parser;

import com.textgraph.core.model.Direction;
import com.textgraph.core.model.Edge;
import com.textgraph.core.model.EdgeType;
import com.textgraph.core.model.Graph;
import com.textgraph.core.model.Group;
import com.textgraph.core.model.Node;
import com.textgraph.core.model.NodeShape;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link FlowchartParser}.
 */
class FlowchartParserTest {

    private final FlowchartParser parser = new FlowchartParser();

    @Test
    void parse_header_setsDirection() {
        assertThat(parser.parse("graph LR\nA --> B\n").direction()).isEqualTo(Direction.LR);
        assertThat(parser.parse("flowchart TB\nA --> B\n").direction()).isEqualTo(Direction.TD);
        assertThat(parser.parse("flowchart BT\n").direction()).isEqualTo(Direction.BT);
    }

    @Test
    void parse_noHeader_defaultsToTopDown() {
        Graph graph = parser.parse("A --> B");

        assertThat(graph.direction()).isEqualTo(Direction.TD);
        assertThat(graph.edges()).singleElement().satisfies(e -> {
            assertThat(e.source()).isEqualTo("A");
            assertThat(e.target()).isEqualTo("B");
        });
    }

    @Test
    void parse_shapes_setShapeAndLabel() {
        Graph graph = parser.parse("""
            graph TD
              a[Box]
              b(Rounded)
              c{Choice?}
              d((Circle))
              e
            """);

        assertThat(graph.nodes()).extracting(Node::id, Node::shape, Node::label).containsExactly(
            tuple("a", NodeShape.RECTANGLE, "Box"),
            tuple("b", NodeShape.ROUNDED, "Rounded"),
            tuple("c", NodeShape.DIAMOND, "Choice?"),
            tuple("d", NodeShape.CIRCLE, "Circle"),
            tuple("e", NodeShape.RECTANGLE, "e"));
    }

    @Test
    void parse_quotedLabel_handlesEscapes() {
        Graph graph = parser.parse("A[\"first\\nsecond \\\"q\\\"\"]");

        assertThat(graph.node("A")).get().extracting(Node::label).isEqualTo("first\nsecond \"q\"");
    }

    @ParameterizedTest
    @CsvSource({
        "-->, ARROW",
        "---, LINE",
        "-.->, DOTTED_ARROW",
        "-.-, DOTTED_LINE",
        "==>, THICK_ARROW",
        "===, THICK_LINE",
        "<-->, BIDIR_ARROW",
        "<-.->, BIDIR_DOTTED",
        "<==>, BIDIR_THICK"
    })
    void parse_connector_mapsToEdgeType(String token, EdgeType expected) {
        Graph graph = parser.parse("A " + token + " B");

        assertThat(graph.edges()).extracting(Edge::type).containsExactly(expected);
    }

    @Test
    void parse_connectorWithoutSpaces_splitsIds() {
        Graph graph = parser.parse("my-node-->B\nB-.->C");

        assertThat(graph.nodes()).extracting(Node::id).containsExactly("my-node", "B", "C");
        assertThat(graph.edges()).extracting(Edge::type).containsExactly(EdgeType.ARROW, EdgeType.DOTTED_ARROW);
    }

    @Test
    void parse_edgeLabel_isTrimmed() {
        Graph graph = parser.parse("A -->| yes | B");

        assertThat(graph.edges()).extracting(Edge::label).containsExactly("yes");
    }

    @Test
    void parse_chain_createsEdgePerLink() {
        Graph graph = parser.parse("A --> B[Bee] -.-> C");

        assertThat(graph.edges()).extracting(Edge::source, Edge::target).containsExactly(
            tuple("A", "B"),
            tuple("B", "C"));
        assertThat(graph.node("B")).get().extracting(Node::label).isEqualTo("Bee");
    }

    @Test
    void parse_bareReferenceBeforeDeclaration_declarationWins() {
        Graph graph = parser.parse("""
            A --> B
            B[Later label]
            B[Ignored]
            """);

        assertThat(graph.node("B")).get().extracting(Node::label).isEqualTo("Later label");
    }

    @Test
    void parse_comments_areIgnored() {
        Graph graph = parser.parse("""
            %% leading comment
            graph TD
              A --> B %% trailing comment
              %% C --> D
            """);

        assertThat(graph.nodes()).extracting(Node::id).containsExactly("A", "B");
    }

    @Test
    void parse_subgraph_collectsMembersAndDescription() {
        Graph graph = parser.parse("""
            graph TD
              A --> X
              subgraph Backend
                direction LR
                %% desc: server side
                X[API] --> Y[Database]
              end
              Y --> Z
            """);

        assertThat(graph.groups()).singleElement().satisfies(group -> {
            assertThat(group.name()).isEqualTo("Backend");
            assertThat(group.description()).isEqualTo("server side");
            assertThat(group.members()).containsExactly("X", "Y");
        });
        assertThat(graph.node("X")).get().extracting(Node::group).isEqualTo("Backend");
        assertThat(graph.node("Z")).get().extracting(Node::group).isNull();
    }

    @Test
    void parse_nestedSubgraphs_buildGroupTree() {
        Graph graph = parser.parse("""
            subgraph "Outer box"
              A
              subgraph Inner
                B
              end
            end
            """);

        Group outer = graph.groups().get(0);
        assertThat(outer.name()).isEqualTo("Outer box");
        assertThat(outer.members()).containsExactly("A");
        assertThat(outer.groups()).extracting(Group::name).containsExactly("Inner");
        assertThat(outer.groups().get(0).members()).containsExactly("B");
    }

    @Test
    void parse_endInsideIdentifier_doesNotCloseSubgraph() {
        Graph graph = parser.parse("""
            subgraph G
              endpoint --> ending
            end
            """);

        assertThat(graph.groups().get(0).members()).containsExactly("endpoint", "ending");
    }

    @Test
    void parse_garbage_isSkipped() {
        Graph graph = parser.parse("graph TD\n  ;; A --> B ;;\n  @@@\n");

        assertThat(graph.edges()).hasSize(1);
        assertThat(graph.nodes()).extracting(Node::id).containsExactly("A", "B");
    }

    @Test
    void parse_emptySource_returnsEmptyGraph() {
        assertThat(parser.parse("").isEmpty()).isTrue();
        assertThat(parser.parse("graph LR\n").isEmpty()).isTrue();
    }
}
