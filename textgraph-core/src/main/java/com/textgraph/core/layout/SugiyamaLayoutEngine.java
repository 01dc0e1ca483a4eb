package com.textgraph.core.layout;

import com.textgraph.core.layout.group.CollapsedGraph;
import com.textgraph.core.layout.group.GroupCollapser;
import com.textgraph.core.layout.group.GroupExpander;
import com.textgraph.core.layout.routing.EdgeRouter;
import com.textgraph.core.layout.routing.GridEdgeRouter;
import com.textgraph.core.layout.routing.RoutingContext;
import com.textgraph.core.model.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Layered (Sugiyama-style) layout of a {@link Graph}.
 *
 * <p>Stages, each producing a new structure from the previous one:
 * <ol>
 *   <li>{@link GroupCollapser} folds top-level groups into compound vertices</li>
 *   <li>{@link CycleRemover} reverses back-edges</li>
 *   <li>{@link LayerAssigner} ranks vertices</li>
 *   <li>{@link DummyNodeInserter} splits long edges</li>
 *   <li>{@link CrossingMinimizer} orders each layer</li>
 *   <li>{@link CoordinateAssigner} places boxes</li>
 *   <li>{@link GroupExpander} places group members inside their compound</li>
 *   <li>an {@link EdgeRouter} draws the paths</li>
 * </ol>
 *
 * <p>The engine holds no state between calls and can be reused.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SugiyamaLayoutEngine engine = new SugiyamaLayoutEngine(1, new GridEdgeRouter());
 * LayoutResult result = engine.layout(graph);
 * }</pre>
 */
public class SugiyamaLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(SugiyamaLayoutEngine.class);

    private final int padding;
    private final EdgeRouter router;

    public SugiyamaLayoutEngine() {
        this(LayoutConstants.DEFAULT_PADDING, new GridEdgeRouter());
    }

    /**
     * Creates an engine.
     *
     * @param padding blank columns on each side of a node label, negative values count as 0
     * @param router edge routing strategy
     */
    public SugiyamaLayoutEngine(int padding, EdgeRouter router) {
        this.padding = Math.max(0, padding);
        this.router = Objects.requireNonNull(router, "router must not be null");
    }

    /**
     * Lays out a graph.
     *
     * @param graph graph to lay out
     * @return placed boxes and routed edges; empty for an empty graph
     */
    public LayoutResult layout(Graph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        if (graph.isEmpty()) {
            return LayoutResult.empty(graph.direction());
        }

        CollapsedGraph collapsed = new GroupCollapser(padding).collapse(graph);
        CycleRemoval removal = new CycleRemover().remove(collapsed.graph());
        LayerAssignment layering = new LayerAssigner().assign(removal.dag());
        AugmentedGraph augmented = new DummyNodeInserter().insert(removal.dag(), layering);
        List<List<String>> ordering = new CrossingMinimizer().minimize(augmented);
        Map<String, LayoutNode> placed = new CoordinateAssigner(padding)
            .assign(augmented, ordering, collapsed.sizeOverrides(), graph.direction());
        Map<String, LayoutNode> expanded = new GroupExpander().expand(collapsed, placed);

        RoutingContext context = new RoutingContext(graph.edges(), expanded, augmented, collapsed,
            removal.backEdges(), graph.direction());
        List<RoutedEdge> edges = router.route(context);

        List<LayoutNode> boxes = new ArrayList<>();
        for (LayoutNode node : expanded.values()) {
            if (!node.isDummy()) {
                boxes.add(node);
            }
        }
        log.debug("Layout: {} boxes, {} edges, {} layers, {} back-edges",
            boxes.size(), edges.size(), augmented.layerCount(), removal.backEdges().size());
        return new LayoutResult(boxes, edges, removal.backEdges(), graph.direction(), augmented.layerCount());
    }
}
