package com.textgraph;

import ch.qos.logback.classic.Level;
import com.textgraph.cli.ListCommand;
import com.textgraph.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Main CLI entry point for textgraph.
 *
 * <p>textgraph draws flowcharts as text diagrams made of box-drawing characters.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a flowchart file (or stdin) as text</li>
 *   <li>{@code list} - List routers, directions or edge types</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render a file
 * textgraph render diagram.mmd
 *
 * # Render stdin with ASCII glyphs, left to right
 * echo "graph TD; A --> B" | textgraph -q render --ascii --direction LR
 *
 * # List edge routers
 * textgraph list routers
 * }</pre>
 */
@Command(
    name = "textgraph",
    mixinStandardHelpOptions = true,
    version = "textgraph 1.0.0-SNAPSHOT",
    description = "Renders flowcharts as box-drawing text diagrams",
    subcommands = {
        RenderCommand.class,
        ListCommand.class
    }
)
public class TextGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TextGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("textgraph 1.0.0-SNAPSHOT");
        out.println("Lays out flowcharts in layers and draws them with box-drawing characters.");
        out.println();
        out.println("  textgraph render flow.mmd            draw a flowchart file");
        out.println("  textgraph render --ascii < flow.mmd  plain ASCII from standard input");
        out.println("  textgraph list routers               show the available edge routers");
        out.flush();
    }

    /**
     * Applies {@code -q}/{@code -v} to the Logback root logger. Layout and routing log at
     * DEBUG, so {@code -v} shows every pipeline stage of a render.
     */
    public void configureLogging() {
        if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
            root.setLevel(logLevel());
        } else {
            log.debug("Logging backend is not Logback; -v and -q have no effect");
        }
    }

    Level logLevel() {
        if (quiet) {
            return Level.ERROR;
        }
        return verbose ? Level.DEBUG : Level.INFO;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine(System.out, System.err).execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with UTF-8 output streams, so box-drawing glyphs survive a
     * platform default charset such as US-ASCII.
     *
     * @param stdout stream for diagrams and listings
     * @param stderr stream for usage and error messages
     * @return configured command line
     */
    public static CommandLine newCommandLine(OutputStream stdout, OutputStream stderr) {
        CommandLine commandLine = new CommandLine(new TextGraphCLI());
        commandLine.setOut(new PrintWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8), true));
        commandLine.setErr(new PrintWriter(new OutputStreamWriter(stderr, StandardCharsets.UTF_8), true));
        return commandLine;
    }
}
