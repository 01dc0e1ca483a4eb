package com.textgraph.core.layout;

/**
 * A cell on the character grid.
 *
 * @param x column
 * @param y row
 */
public record Point(int x, int y) {

    public Point transposed() {
        return new Point(y, x);
    }

    /**
     * Returns whether the segment to another point is horizontal or vertical.
     *
     * @param other other end of the segment
     * @return true if the points share a row or a column
     */
    public boolean isAlignedWith(Point other) {
        return x == other.x || y == other.y;
    }
}
