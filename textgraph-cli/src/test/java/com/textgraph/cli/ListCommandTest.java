package com.textgraph.cli;

import com.textgraph.TextGraphCLI;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class ListCommandTest {

    private final StringWriter out = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new TextGraphCLI());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    @Test
    void list_routers_showsRegisteredRouters() {
        assertThat(execute("list", "routers")).isZero();

        assertThat(out.toString())
            .contains("Available Edge Routers:")
            .contains("(ID: grid)")
            .contains("(ID: waypoint)");
    }

    @Test
    void list_directions_showsAllFour() {
        assertThat(execute("list", "directions")).isZero();

        assertThat(out.toString()).contains("TD (alias: TB)", "BT", "LR", "RL");
    }

    @Test
    void list_edgeTypes_showsTokens() {
        assertThat(execute("list", "edge-types")).isZero();

        assertThat(out.toString()).contains("-->", "-.->", "<==>", "bidir_dotted");
    }

    @Test
    void list_formats_showsTextAndSvg() {
        assertThat(execute("list", "formats")).isZero();

        assertThat(out.toString()).contains("text (.txt)", "svg (.svg)");
    }

    @Test
    void list_unknownType_returnsOne() {
        assertThat(execute("list", "colours")).isEqualTo(1);
    }
}
