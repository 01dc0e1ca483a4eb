package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for cleaning up orthogonal paths.
 */
final class OrthogonalPaths {

    private OrthogonalPaths() {
        // Utility class
    }

    /**
     * Drops repeated points and interior points that continue a straight line.
     *
     * <p>Diagonal steps get an elbow so every segment is horizontal or vertical.
     *
     * @param path raw path
     * @return path whose consecutive points are distinct, aligned, and change direction
     */
    static List<Point> simplify(List<Point> path) {
        List<Point> aligned = new ArrayList<>();
        for (Point point : path) {
            if (!aligned.isEmpty()) {
                Point last = aligned.get(aligned.size() - 1);
                if (last.equals(point)) {
                    continue;
                }
                if (!last.isAlignedWith(point)) {
                    aligned.add(new Point(last.x(), point.y()));
                }
            }
            aligned.add(point);
        }
        if (aligned.size() <= 2) {
            return aligned;
        }

        List<Point> result = new ArrayList<>();
        result.add(aligned.get(0));
        for (int i = 1; i < aligned.size() - 1; i++) {
            Point prev = result.get(result.size() - 1);
            Point cur = aligned.get(i);
            Point next = aligned.get(i + 1);
            boolean straight = (prev.x() == cur.x() && cur.x() == next.x() && between(prev.y(), cur.y(), next.y()))
                || (prev.y() == cur.y() && cur.y() == next.y() && between(prev.x(), cur.x(), next.x()));
            if (!straight) {
                result.add(cur);
            }
        }
        result.add(aligned.get(aligned.size() - 1));
        return result;
    }

    private static boolean between(int a, int b, int c) {
        return (a <= b && b <= c) || (a >= b && b >= c);
    }

    /**
     * Rewrites horizontal first and last segments into a one-row jog so the path leaves its
     * source and enters its target vertically.
     *
     * @param path simplified path running downward in flow space
     * @return adjusted and simplified path
     */
    static List<Point> ensureVerticalEndpoints(List<Point> path) {
        if (path.size() < 2) {
            return path;
        }
        List<Point> result = new ArrayList<>(path);

        int n = result.size();
        Point last = result.get(n - 1);
        Point beforeLast = result.get(n - 2);
        if (last.y() == beforeLast.y() && last.y() - 1 >= result.get(0).y()) {
            int row = last.y() - 1;
            result.set(n - 2, new Point(beforeLast.x(), row));
            result.add(n - 1, new Point(last.x(), row));
        }

        Point first = result.get(0);
        Point second = result.get(1);
        if (first.y() == second.y() && result.size() > 2 && first.y() + 1 < result.get(result.size() - 1).y()) {
            int row = first.y() + 1;
            result.set(1, new Point(second.x(), row));
            result.add(1, new Point(first.x(), row));
        }
        return simplify(result);
    }

    static List<Point> reversed(List<Point> path) {
        List<Point> result = new ArrayList<>(path);
        Collections.reverse(result);
        return result;
    }

    static List<Point> transposed(List<Point> path) {
        List<Point> result = new ArrayList<>(path.size());
        for (Point point : path) {
            result.add(point.transposed());
        }
        return result;
    }
}
