package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Routes edges with A* search around node boxes.
 *
 * <p>This is the default router. When no path exists, for example because the target is
 * boxed in, the edge falls back to a direct route through the middle row.
 */
public class GridEdgeRouter extends AbstractEdgeRouter {

    private static final Logger log = LoggerFactory.getLogger(GridEdgeRouter.class);

    public static final String ID = "grid";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Grid Path Router (A*)";
    }

    @Override
    protected PathPlanner planner(FlowLayout flow) {
        GridPathFinder finder = new GridPathFinder(OccupancyGrid.of(flow.boxes().values()));
        return (upper, lower, layoutPair, start, end) -> {
            Optional<List<Point>> path = finder.findPath(start, end);
            if (path.isPresent()) {
                return path.get();
            }
            log.debug("No free path from '{}' to '{}'; using direct route", upper.id(), lower.id());
            return directRoute(start, end);
        };
    }
}
