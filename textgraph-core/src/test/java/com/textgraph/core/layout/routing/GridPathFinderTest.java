package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GridPathFinderTest {

    @Test
    void findPath_freeGrid_goesStraight() {
        GridPathFinder finder = new GridPathFinder(new OccupancyGrid(5, 5));

        List<Point> path = finder.findPath(new Point(2, 0), new Point(2, 4)).orElseThrow();

        assertThat(path).hasSize(5).allMatch(p -> p.x() == 2);
    }

    @Test
    void findPath_obstacle_goesAround() {
        OccupancyGrid grid = new OccupancyGrid(7, 7);
        grid.block(1, 3, 3, 1);
        GridPathFinder finder = new GridPathFinder(grid);

        List<Point> path = finder.findPath(new Point(2, 0), new Point(2, 6)).orElseThrow();

        assertThat(path.get(0)).isEqualTo(new Point(2, 0));
        assertThat(path.get(path.size() - 1)).isEqualTo(new Point(2, 6));
        assertThat(path).allMatch(p -> grid.isFree(p.x(), p.y()));
        for (int i = 1; i < path.size(); i++) {
            Point a = path.get(i - 1);
            Point b = path.get(i);
            assertThat(Math.abs(a.x() - b.x()) + Math.abs(a.y() - b.y())).isEqualTo(1);
        }
    }

    @Test
    void findPath_blockedGoal_stillReached() {
        OccupancyGrid grid = new OccupancyGrid(3, 3);
        grid.block(1, 2, 1, 1);

        assertThat(new GridPathFinder(grid).findPath(new Point(1, 0), new Point(1, 2))).isPresent();
    }

    @Test
    void findPath_walledOff_returnsEmpty() {
        OccupancyGrid grid = new OccupancyGrid(5, 5);
        grid.block(0, 2, 5, 1);

        assertThat(new GridPathFinder(grid).findPath(new Point(2, 0), new Point(2, 4))).isEmpty();
    }

    @Test
    void findPath_outsideGrid_returnsEmpty() {
        assertThat(new GridPathFinder(new OccupancyGrid(2, 2)).findPath(new Point(0, 0), new Point(5, 5))).isEmpty();
    }
}
