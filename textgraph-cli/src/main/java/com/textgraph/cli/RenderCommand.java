package com.textgraph.cli;

import com.textgraph.TextGraphCLI;
import com.textgraph.core.TextGraph;
import com.textgraph.core.config.ConfigLoader;
import com.textgraph.core.config.OutputFormat;
import com.textgraph.core.config.RenderConfig;
import com.textgraph.core.model.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to render a flowchart as a text diagram or an SVG document.
 *
 * <p>Reads the flowchart from a file, or from standard input when no file is given, and
 * writes the diagram to standard output or to {@code --output}. Options are taken from
 * {@code --config}, or from {@code textgraph.yaml} in the working directory when present;
 * flags given on the command line win over file values.
 *
 * <p>Exit codes: {@code 0} success, {@code 1} input or output failure, {@code 2} bad arguments.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * textgraph render flow.mmd
 * textgraph render --ascii --padding 2 --direction LR flow.mmd -o flow.txt
 * cat flow.mmd | textgraph render --router waypoint
 * textgraph render --format svg flow.mmd -o flow.svg
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a flowchart as a text diagram or SVG",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @ParentCommand
    private TextGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Flowchart file (default: standard input)")
    private Path input;

    @Option(names = {"-a", "--ascii"}, description = "Use plain ASCII instead of box-drawing glyphs")
    private boolean ascii;

    @Option(names = {"-p", "--padding"}, description = "Spaces between a label and its border")
    private Integer padding;

    @Option(names = {"-d", "--direction"}, description = "Override the flowchart direction: TD, TB, BT, LR, RL")
    private String direction;

    @Option(names = {"-r", "--router"}, description = "Edge router id (see 'list routers')")
    private String router;

    @Option(names = {"-f", "--format"}, description = "Output format: text or svg")
    private String format;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./textgraph.yaml if present)")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Write the diagram to this file instead of stdout")
    private Path output;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        RenderConfig config;
        try {
            config = applyOverrides(loadConfig());
        } catch (IllegalArgumentException e) {
            log.error("Invalid option: {}", e.getMessage());
            return EXIT_USAGE;
        }

        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            log.error("Failed to read {}: {}", input == null ? "standard input" : input, e.getMessage());
            return EXIT_IO;
        }

        String diagram;
        try {
            diagram = TextGraph.renderSource(source, config);
        } catch (IllegalArgumentException e) {
            log.error("Invalid option: {}", e.getMessage());
            return EXIT_USAGE;
        }

        try {
            writeDiagram(diagram);
        } catch (IOException e) {
            log.error("Failed to write {}: {}", output, e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }

    private RenderConfig loadConfig() {
        if (configFile != null) {
            return ConfigLoader.load(configFile);
        }
        Path conventional = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.isRegularFile(conventional)) {
            return ConfigLoader.load(conventional);
        }
        return RenderConfig.defaults();
    }

    private RenderConfig applyOverrides(RenderConfig config) {
        RenderConfig result = config;
        if (ascii) {
            result = result.withUnicode(false);
        }
        if (padding != null) {
            result = result.withPadding(padding);
        }
        if (direction != null) {
            result = result.withDirection(Direction.parse(direction));
        }
        if (router != null) {
            result = result.withRouter(router);
        }
        if (format != null) {
            result = result.withFormat(OutputFormat.parse(format));
        }
        return result;
    }

    private String readSource() throws IOException {
        if (input == null) {
            log.debug("Reading flowchart from standard input");
            InputStream in = System.in;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        log.debug("Reading flowchart from {}", input);
        return Files.readString(input, StandardCharsets.UTF_8);
    }

    private void writeDiagram(String diagram) throws IOException {
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(diagram);
            out.flush();
            return;
        }
        Path dir = output.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Files.writeString(output, diagram, StandardCharsets.UTF_8);
        log.info("Diagram written to {}", output);
    }
}
