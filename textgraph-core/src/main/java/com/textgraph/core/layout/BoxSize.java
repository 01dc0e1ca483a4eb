package com.textgraph.core.layout;

/**
 * Width and height of a box in character cells.
 *
 * @param width columns
 * @param height rows
 */
public record BoxSize(int width, int height) {

    /**
     * Compact constructor with validation.
     */
    public BoxSize {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Box size must be positive: " + width + "x" + height);
        }
    }

    public BoxSize transposed() {
        return new BoxSize(height, width);
    }

    /**
     * Size of a bordered box around a possibly multi-line label.
     *
     * @param label label text, lines separated by {@code \n}
     * @param padding blank columns on each side of the widest line
     * @return box size
     */
    public static BoxSize forLabel(String label, int padding) {
        String[] lines = (label == null ? "" : label).split("\n", -1);
        int widest = 0;
        for (String line : lines) {
            widest = Math.max(widest, line.length());
        }
        return new BoxSize(widest + 2 + 2 * Math.max(0, padding), 2 + lines.length);
    }
}
