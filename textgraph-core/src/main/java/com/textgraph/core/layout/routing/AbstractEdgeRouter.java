package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.EdgeKey;
import com.textgraph.core.layout.LayoutNode;
import com.textgraph.core.layout.Point;
import com.textgraph.core.layout.RoutedEdge;
import com.textgraph.core.layout.group.CollapsedGraph;
import com.textgraph.core.model.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class holding the routing rules shared by all routers.
 *
 * <p>Paths are computed in flow space, where layers run top to bottom; horizontal directions
 * are transposed in and out. For every edge:
 * <ul>
 *   <li>self-loops are skipped;</li>
 *   <li>an edge between a group and one of its own members is skipped;</li>
 *   <li>when the target lies below the source, the path leaves the bottom centre of the source
 *       and arrives at the top centre of the target;</li>
 *   <li>when the target lies above, the path is planned from target to source and reversed, so
 *       it still ends at the target;</li>
 *   <li>boxes side by side (such as members of one group) are joined between their facing
 *       sides.</li>
 * </ul>
 * Subclasses only decide how to get from the exit cell to the entry cell.
 */
public abstract class AbstractEdgeRouter implements EdgeRouter {

    private static final Logger log = LoggerFactory.getLogger(AbstractEdgeRouter.class);

    @Override
    public final List<RoutedEdge> route(RoutingContext context) {
        boolean horizontal = context.direction().isHorizontal();
        Map<String, LayoutNode> boxes = new LinkedHashMap<>();
        Map<String, LayoutNode> dummies = new LinkedHashMap<>();
        for (LayoutNode node : context.placed().values()) {
            LayoutNode flow = horizontal ? node.transposed() : node;
            if (node.isDummy()) {
                dummies.put(node.id(), flow);
            } else {
                boxes.put(node.id(), flow);
            }
        }
        FlowLayout flow = new FlowLayout(boxes, dummies, context);
        PathPlanner planner = planner(flow);
        CollapsedGraph collapsed = context.collapsed();

        List<RoutedEdge> routed = new ArrayList<>();
        for (Edge edge : context.edges()) {
            if (edge.isSelfLoop()) {
                log.debug("Skipping self-loop on '{}'", edge.source());
                continue;
            }
            String sourceBox = boxIdOf(collapsed, edge.source());
            String targetBox = boxIdOf(collapsed, edge.target());
            if (sourceBox.equals(targetBox) || collapsed.isNested(sourceBox, targetBox)) {
                log.debug("Skipping edge {} -> {} between a group and its own content", edge.source(), edge.target());
                continue;
            }
            LayoutNode source = boxOf(boxes, sourceBox);
            LayoutNode target = boxOf(boxes, targetBox);
            EdgeKey layoutPair = new EdgeKey(layoutIdOf(collapsed, edge.source()), layoutIdOf(collapsed, edge.target()));

            List<Point> path = plan(source, target, layoutPair, planner);
            if (horizontal) {
                path = OrthogonalPaths.transposed(path);
            }
            boolean backEdge = context.backEdges().contains(layoutPair);
            routed.add(new RoutedEdge(edge.source(), edge.target(), edge.type(), edge.label(), path, backEdge));
        }
        log.debug("{} routed {} of {} edges", getId(), routed.size(), context.edges().size());
        return routed;
    }

    /**
     * Creates the planner used for one routing run.
     *
     * @param flow boxes and dummies in flow space
     * @return planner for downward paths
     */
    protected abstract PathPlanner planner(FlowLayout flow);

    private List<Point> plan(LayoutNode source, LayoutNode target, EdgeKey layoutPair, PathPlanner planner) {
        if (target.y() >= source.bottom() + 3) {
            return downward(source, target, layoutPair, planner);
        }
        if (source.y() >= target.bottom() + 3) {
            return OrthogonalPaths.reversed(downward(target, source, layoutPair.reversed(), planner));
        }
        return sideways(source, target);
    }

    private static List<Point> downward(LayoutNode upper, LayoutNode lower, EdgeKey pair, PathPlanner planner) {
        Point start = new Point(upper.centerX(), upper.bottom() + 1);
        Point end = new Point(lower.centerX(), lower.y() - 1);
        List<Point> raw = planner.plan(upper, lower, pair, start, end);
        return OrthogonalPaths.ensureVerticalEndpoints(OrthogonalPaths.simplify(raw));
    }

    private static List<Point> sideways(LayoutNode source, LayoutNode target) {
        Point start;
        Point end;
        if (target.x() > source.right()) {
            start = new Point(source.right() + 1, source.centerY());
            end = new Point(target.x() - 1, target.centerY());
        } else if (target.right() < source.x()) {
            start = new Point(source.x() - 1, source.centerY());
            end = new Point(target.right() + 1, target.centerY());
        } else {
            log.debug("Boxes '{}' and '{}' overlap; drawing a stub", source.id(), target.id());
            return List.of(new Point(source.centerX(), source.bottom() + 1));
        }
        if (start.y() == end.y()) {
            return OrthogonalPaths.simplify(List.of(start, end));
        }
        int midX = (start.x() + end.x()) / 2;
        return OrthogonalPaths.simplify(List.of(start, new Point(midX, start.y()), new Point(midX, end.y()), end));
    }

    /**
     * Direct route through the middle row between exit and entry.
     *
     * @param start exit cell
     * @param end entry cell
     * @return orthogonal path with at most two bends
     */
    protected static List<Point> directRoute(Point start, Point end) {
        int midY = (start.y() + end.y()) / 2;
        return List.of(start, new Point(start.x(), midY), new Point(end.x(), midY), end);
    }

    private static String boxIdOf(CollapsedGraph collapsed, String id) {
        return collapsed.boxId(id)
            .orElseThrow(() -> new IllegalStateException("Edge endpoint has no box: " + id));
    }

    private static String layoutIdOf(CollapsedGraph collapsed, String id) {
        return collapsed.layoutId(id)
            .orElseThrow(() -> new IllegalStateException("Edge endpoint has no layout vertex: " + id));
    }

    private static LayoutNode boxOf(Map<String, LayoutNode> boxes, String id) {
        LayoutNode node = boxes.get(id);
        if (node == null) {
            throw new IllegalStateException("No placed box for '" + id + "'");
        }
        return node;
    }

    /**
     * Plans a path from the cell below an upper box to the cell above a lower box.
     */
    @FunctionalInterface
    protected interface PathPlanner {

        /**
         * Plans one path in flow space.
         *
         * @param upper box the path leaves
         * @param lower box the path enters
         * @param layoutPair outer-layout vertices of upper and lower, in that order
         * @param start exit cell below {@code upper}
         * @param end entry cell above {@code lower}
         * @return path from start to end; may contain collinear points
         */
        List<Point> plan(LayoutNode upper, LayoutNode lower, EdgeKey layoutPair, Point start, Point end);
    }

    /**
     * Placed boxes in flow space.
     *
     * @param boxes nodes and group boxes
     * @param dummies dummy vertices
     * @param context original routing context
     */
    protected record FlowLayout(Map<String, LayoutNode> boxes, Map<String, LayoutNode> dummies,
                                RoutingContext context) {
    }
}
