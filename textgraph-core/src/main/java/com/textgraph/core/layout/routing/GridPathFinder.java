package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * A* search over an {@link OccupancyGrid} in the four axis directions.
 *
 * <p>Each step costs 1 and each change of direction adds {@link #TURN_PENALTY}, which
 * favours paths with fewer bends. The heuristic is the Manhattan distance plus one when a bend
 * is unavoidable. The goal cell may be blocked, since it usually touches a box border.
 */
public final class GridPathFinder {

    static final int TURN_PENALTY = 1;

    private static final int[][] STEPS = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}};
    private static final int NO_DIRECTION = STEPS.length;

    private final OccupancyGrid grid;

    public GridPathFinder(OccupancyGrid grid) {
        this.grid = grid;
    }

    /**
     * Finds a cheapest path.
     *
     * @param start first cell, used even if blocked
     * @param goal last cell, reachable even if blocked
     * @return cells from start to goal, or empty if the goal is unreachable
     */
    public Optional<List<Point>> findPath(Point start, Point goal) {
        if (!grid.contains(start.x(), start.y()) || !grid.contains(goal.x(), goal.y())) {
            return Optional.empty();
        }

        PriorityQueue<SearchNode> open = new PriorityQueue<>(
            Comparator.comparingInt(SearchNode::priority).thenComparingLong(SearchNode::sequence));
        Map<State, Integer> bestCost = new HashMap<>();
        Map<State, State> cameFrom = new HashMap<>();
        long sequence = 0;

        State initial = new State(start.x(), start.y(), NO_DIRECTION);
        bestCost.put(initial, 0);
        open.add(new SearchNode(initial, 0, heuristic(start.x(), start.y(), goal), sequence++));

        while (!open.isEmpty()) {
            SearchNode current = open.poll();
            State state = current.state();
            if (current.cost() > bestCost.getOrDefault(state, Integer.MAX_VALUE)) {
                continue;
            }
            if (state.x() == goal.x() && state.y() == goal.y()) {
                return Optional.of(reconstruct(cameFrom, state));
            }

            for (int dir = 0; dir < STEPS.length; dir++) {
                int nx = state.x() + STEPS[dir][0];
                int ny = state.y() + STEPS[dir][1];
                boolean isGoal = nx == goal.x() && ny == goal.y();
                if (!isGoal && !grid.isFree(nx, ny)) {
                    continue;
                }
                int cost = current.cost() + 1;
                if (state.direction() != NO_DIRECTION && state.direction() != dir) {
                    cost += TURN_PENALTY;
                }
                State next = new State(nx, ny, dir);
                if (cost < bestCost.getOrDefault(next, Integer.MAX_VALUE)) {
                    bestCost.put(next, cost);
                    cameFrom.put(next, state);
                    open.add(new SearchNode(next, cost, cost + heuristic(nx, ny, goal), sequence++));
                }
            }
        }
        return Optional.empty();
    }

    private static int heuristic(int x, int y, Point goal) {
        int dx = Math.abs(x - goal.x());
        int dy = Math.abs(y - goal.y());
        return dx == 0 || dy == 0 ? dx + dy : dx + dy + TURN_PENALTY;
    }

    private static List<Point> reconstruct(Map<State, State> cameFrom, State end) {
        List<Point> path = new ArrayList<>();
        State cursor = end;
        while (cursor != null) {
            path.add(new Point(cursor.x(), cursor.y()));
            cursor = cameFrom.get(cursor);
        }
        Collections.reverse(path);
        return path;
    }

    private record State(int x, int y, int direction) {
    }

    private record SearchNode(State state, int cost, int priority, long sequence) {
    }
}
