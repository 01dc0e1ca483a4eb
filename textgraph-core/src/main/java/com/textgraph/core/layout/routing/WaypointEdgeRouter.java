package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.AugmentedGraph;
import com.textgraph.core.layout.DummyChain;
import com.textgraph.core.layout.EdgeKey;
import com.textgraph.core.layout.LayoutNode;
import com.textgraph.core.layout.Point;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Routes edges through the dummy vertices placed for them, without any search.
 *
 * <p>A path drops from the exit cell, turns in the gap above each dummy to reach the dummy's
 * column, runs down through it, and finally turns in the gap above the target. Single-layer
 * edges bend once in the middle of the gap.
 */
public class WaypointEdgeRouter extends AbstractEdgeRouter {

    public static final String ID = "waypoint";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Dummy Waypoint Router";
    }

    @Override
    protected PathPlanner planner(FlowLayout flow) {
        AugmentedGraph augmented = flow.context().augmented();
        return (upper, lower, layoutPair, start, end) -> {
            List<LayoutNode> dummies = dummiesFor(augmented, layoutPair, flow);
            if (dummies.isEmpty()) {
                return directRoute(start, end);
            }
            List<Point> path = new ArrayList<>();
            path.add(start);
            Point cursor = start;
            for (LayoutNode dummy : dummies) {
                int turnRow = Math.max(cursor.y(), dummy.y() - 2);
                if (dummy.x() != cursor.x()) {
                    path.add(new Point(cursor.x(), turnRow));
                    path.add(new Point(dummy.x(), turnRow));
                }
                cursor = new Point(dummy.x(), dummy.bottom());
                path.add(cursor);
            }
            int turnRow = Math.max(cursor.y(), end.y() - 1);
            if (end.x() != cursor.x()) {
                path.add(new Point(cursor.x(), turnRow));
                path.add(new Point(end.x(), turnRow));
            }
            path.add(end);
            return path;
        };
    }

    private static List<LayoutNode> dummiesFor(AugmentedGraph augmented, EdgeKey pair, FlowLayout flow) {
        Optional<DummyChain> chain = augmented.chainFor(pair);
        if (chain.isEmpty()) {
            chain = augmented.chainFor(pair.reversed());
        }
        List<LayoutNode> result = new ArrayList<>();
        chain.ifPresent(c -> {
            for (String id : c.dummies()) {
                LayoutNode dummy = flow.dummies().get(id);
                if (dummy != null) {
                    result.add(dummy);
                }
            }
        });
        result.sort(Comparator.comparingInt(LayoutNode::y));
        return result;
    }
}
