package com.textgraph.core;

import com.textgraph.core.config.RenderConfig;
import com.textgraph.core.layout.LayoutResult;
import com.textgraph.core.layout.SugiyamaLayoutEngine;
import com.textgraph.core.layout.routing.EdgeRouter;
import com.textgraph.core.layout.routing.EdgeRouters;
import com.textgraph.core.model.Direction;
import com.textgraph.core.model.Graph;
import com.textgraph.core.parser.FlowchartParser;
import com.textgraph.core.render.CharPalette;
import com.textgraph.core.render.SvgDiagramRenderer;
import com.textgraph.core.render.TextDiagramRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point that wires parsing, layout and rendering together.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String text = TextGraph.renderSource("graph LR\n  A --> B\n", RenderConfig.defaults());
 * System.out.print(text);
 * }</pre>
 */
public final class TextGraph {

    private static final Logger log = LoggerFactory.getLogger(TextGraph.class);

    private TextGraph() {
        // Utility class
    }

    /**
     * Lays out and renders a graph.
     *
     * @param graph graph to draw
     * @param config rendering options; the direction override replaces the graph's direction
     * @return diagram text or SVG document, as configured; an empty string for an empty graph
     * @throws IllegalArgumentException if the configured router is unknown
     */
    public static String render(Graph graph, RenderConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Direction override = config.directionOverride();
        Graph effective = override == null ? graph : graph.withDirection(override);
        EdgeRouter router = EdgeRouters.byId(config.router());
        log.debug("Rendering {} with router={}, padding={}, unicode={}, direction={}",
            config.outputFormat(), router.getId(), config.padding(), config.isUnicode(), effective.direction());

        LayoutResult layout = new SugiyamaLayoutEngine(config.padding(), router).layout(effective);
        return switch (config.outputFormat()) {
            case TEXT -> new TextDiagramRenderer(CharPalette.of(config.isUnicode())).render(layout);
            case SVG -> new SvgDiagramRenderer().render(layout);
        };
    }

    /**
     * Parses flowchart source, then renders it.
     *
     * @param source flowchart text
     * @param config rendering options
     * @return diagram text
     */
    public static String renderSource(String source, RenderConfig config) {
        Objects.requireNonNull(source, "source must not be null");
        return render(new FlowchartParser().parse(source), config);
    }
}
