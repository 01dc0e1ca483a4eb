package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.LayoutNode;

import java.util.Collection;

/**
 * Character grid marking the cells covered by boxes.
 */
public final class OccupancyGrid {

    private static final int MARGIN = 4;

    private final int width;
    private final int height;
    private final boolean[][] blocked;

    public OccupancyGrid(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.blocked = new boolean[height][width];
    }

    /**
     * Builds a grid covering the given boxes with a free margin, blocking every node box.
     * Group boxes are not obstacles, so paths can enter and leave them.
     *
     * @param boxes placed boxes
     * @return grid with node cells blocked
     */
    public static OccupancyGrid of(Collection<LayoutNode> boxes) {
        int maxX = 0;
        int maxY = 0;
        for (LayoutNode box : boxes) {
            maxX = Math.max(maxX, box.right() + 1);
            maxY = Math.max(maxY, box.bottom() + 1);
        }
        OccupancyGrid grid = new OccupancyGrid(maxX + MARGIN, maxY + MARGIN);
        for (LayoutNode box : boxes) {
            if (!box.isCompound() && !box.isDummy()) {
                grid.block(box.x(), box.y(), box.width(), box.height());
            }
        }
        return grid;
    }

    public void block(int x, int y, int w, int h) {
        for (int row = Math.max(0, y); row < Math.min(height, y + h); row++) {
            for (int col = Math.max(0, x); col < Math.min(width, x + w); col++) {
                blocked[row][col] = true;
            }
        }
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public boolean isFree(int x, int y) {
        return contains(x, y) && !blocked[y][x];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
