package com.textgraph.core.render;

import com.textgraph.core.model.LineStyle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-size grid of characters that diagrams are painted on.
 *
 * <p>Writes outside the grid are ignored. {@link #put} overwrites a cell, while
 * {@link #mergeArms} combines a line with the lines already in the cell. Every cell keeps the
 * arms mask of the lines merged into it, so a cell holding a single arm is still known to be a
 * line end when another segment joins it. Cells last written by {@link #put} (box outlines)
 * have no stored mask and are read back from their glyph.
 */
public class Canvas {

    private final int width;
    private final int height;
    private final CharPalette palette;
    private final char[][] cells;
    private final int[][] arms;

    public Canvas(int width, int height, CharPalette palette) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Canvas size must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.palette = Objects.requireNonNull(palette, "palette must not be null");
        this.cells = new char[height][width];
        this.arms = new int[height][width];
        for (char[] row : cells) {
            Arrays.fill(row, ' ');
        }
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public CharPalette palette() {
        return palette;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public char get(int x, int y) {
        return contains(x, y) ? cells[y][x] : ' ';
    }

    public void put(int x, int y, char glyph) {
        if (contains(x, y)) {
            cells[y][x] = glyph;
            arms[y][x] = 0;
        }
    }

    /**
     * Arms merged into a cell so far.
     *
     * @param x column
     * @param y row
     * @return stored arms, {@link Arms#NONE} for cells without merged lines
     */
    public Arms armsAt(int x, int y) {
        return contains(x, y) ? Arms.of(arms[y][x]) : Arms.NONE;
    }

    /**
     * Adds line arms to a cell. Arms already merged into the cell, or read from a box outline
     * glyph, are combined with the new ones; any other content is overwritten.
     *
     * @param x column
     * @param y row
     * @param arms arms to add
     * @param style stroke for straight runs
     */
    public void mergeArms(int x, int y, Arms arms, LineStyle style) {
        if (!contains(x, y)) {
            return;
        }
        Arms existing = this.arms[y][x] != 0
            ? Arms.of(this.arms[y][x])
            : Arms.fromGlyph(cells[y][x], palette).orElse(Arms.NONE);
        Arms merged = existing.union(arms);
        cells[y][x] = merged.toGlyph(palette, style);
        this.arms[y][x] = merged.mask();
    }

    /**
     * Draws a box outline, overwriting what is underneath. Boxes smaller than 2x2 are skipped.
     *
     * @param x left column
     * @param y top row
     * @param w width
     * @param h height
     * @param glyphs outline glyphs
     */
    public void drawBox(int x, int y, int w, int h, BoxGlyphs glyphs) {
        if (w < 2 || h < 2) {
            return;
        }
        int right = x + w - 1;
        int bottom = y + h - 1;
        for (int col = x + 1; col < right; col++) {
            put(col, y, glyphs.horizontal());
            put(col, bottom, glyphs.horizontal());
        }
        for (int row = y + 1; row < bottom; row++) {
            put(x, row, glyphs.vertical());
            put(right, row, glyphs.vertical());
        }
        put(x, y, glyphs.topLeft());
        put(right, y, glyphs.topRight());
        put(x, bottom, glyphs.bottomLeft());
        put(right, bottom, glyphs.bottomRight());
    }

    /**
     * Writes text left to right starting at a cell, clipping at the canvas edge.
     *
     * @param x first column
     * @param y row
     * @param text text without line breaks
     */
    public void writeText(int x, int y, String text) {
        for (int i = 0; i < text.length(); i++) {
            put(x + i, y, text.charAt(i));
        }
    }

    /**
     * Flips the grid upside down, remapping glyphs to their mirror images.
     */
    public void mirrorVertically() {
        for (int top = 0, bottom = height - 1; top < bottom; top++, bottom--) {
            char[] swap = cells[top];
            cells[top] = cells[bottom];
            cells[bottom] = swap;
            int[] swapArms = arms[top];
            arms[top] = arms[bottom];
            arms[bottom] = swapArms;
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                cells[y][x] = GlyphMirror.flipVertical(cells[y][x]);
                arms[y][x] = swapBits(arms[y][x], Arms.UP, Arms.DOWN);
            }
        }
    }

    /**
     * Flips the grid left to right, remapping glyphs to their mirror images.
     */
    public void mirrorHorizontally() {
        for (int y = 0; y < height; y++) {
            char[] row = cells[y];
            int[] rowArms = arms[y];
            for (int left = 0, right = width - 1; left < right; left++, right--) {
                char swap = row[left];
                row[left] = row[right];
                row[right] = swap;
                int swapArms = rowArms[left];
                rowArms[left] = rowArms[right];
                rowArms[right] = swapArms;
            }
            for (int x = 0; x < width; x++) {
                row[x] = GlyphMirror.flipHorizontal(row[x]);
                rowArms[x] = swapBits(rowArms[x], Arms.LEFT, Arms.RIGHT);
            }
        }
    }

    private static int swapBits(int mask, int a, int b) {
        int rest = mask & ~(a | b);
        return rest | ((mask & a) != 0 ? b : 0) | ((mask & b) != 0 ? a : 0);
    }

    /**
     * Serializes the grid: trailing blanks are stripped from every line, trailing empty lines
     * are dropped, and the text ends with exactly one newline.
     *
     * @return text, or an empty string if nothing was painted
     */
    public String toText() {
        List<String> lines = new ArrayList<>();
        for (char[] row : cells) {
            lines.add(stripTrailing(new String(row)));
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }

    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == ' ') {
            end--;
        }
        return line.substring(0, end);
    }
}
