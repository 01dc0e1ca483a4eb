package com.textgraph.cli;

import com.textgraph.core.config.OutputFormat;
import com.textgraph.core.layout.routing.EdgeRouter;
import com.textgraph.core.layout.routing.EdgeRouters;
import com.textgraph.core.model.Direction;
import com.textgraph.core.model.EdgeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list edge routers, directions, edge types or output formats.
 *
 * <p>Routers are discovered through the Java Service Provider Interface, so third-party
 * routers on the classpath show up here too.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * textgraph list routers
 * textgraph list directions
 * textgraph list edge-types
 * textgraph list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available routers, directions, edge types, or output formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: routers, directions, edge-types, or formats"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "routers", "router" -> listRouters();
            case "directions", "direction" -> listDirections();
            case "edge-types", "edge-type", "edges" -> listEdgeTypes();
            case "formats", "format" -> listFormats();
            default -> {
                log.error("Unknown type: {}. Use: routers, directions, edge-types, or formats", type);
                yield 1;
            }
        };
    }

    private int listRouters() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Edge Routers:");
        out.println();

        List<EdgeRouter> routers = EdgeRouters.all();
        for (EdgeRouter router : routers) {
            out.printf("  • %s (ID: %s)%n", router.getDisplayName(), router.getId());
        }
        if (routers.isEmpty()) {
            out.println("  No routers found.");
        }
        out.flush();
        return 0;
    }

    private int listDirections() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Directions:");
        out.println();
        for (Direction direction : Direction.values()) {
            out.printf("  • %s%s%n", direction, direction == Direction.TD ? " (alias: TB)" : "");
        }
        out.flush();
        return 0;
    }

    private int listEdgeTypes() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Edge Types:");
        out.println();
        for (EdgeType edgeType : EdgeType.values()) {
            out.printf("  • %-5s %s%n", edgeType.token(), edgeType.name().toLowerCase(Locale.ROOT));
        }
        out.flush();
        return 0;
    }

    private int listFormats() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Output Formats:");
        out.println();
        for (OutputFormat format : OutputFormat.values()) {
            out.printf("  • %s (.%s)%n", format.name().toLowerCase(Locale.ROOT), format.fileExtension());
        }
        out.flush();
        return 0;
    }
}
