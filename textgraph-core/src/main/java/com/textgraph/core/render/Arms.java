package com.textgraph.core.render;

import com.textgraph.core.model.LineStyle;

import java.util.Optional;

/**
 * The directions in which a line glyph connects to its neighbouring cells, as a 4-bit mask.
 *
 * <p>Line glyphs are merged by OR-ing their masks and mapping the union back to a glyph, so a
 * horizontal line drawn across a vertical one becomes a cross and two meeting segments become
 * a corner. The mapping is total: a single arm maps to the straight line on its axis and the
 * empty mask maps to a blank.
 *
 * @param mask combination of {@link #UP}, {@link #RIGHT}, {@link #DOWN} and {@link #LEFT}
 */
public record Arms(int mask) {

    public static final int UP = 1;
    public static final int RIGHT = 2;
    public static final int DOWN = 4;
    public static final int LEFT = 8;

    public static final Arms NONE = new Arms(0);

    /**
     * Compact constructor with validation.
     */
    public Arms {
        if (mask < 0 || mask > 15) {
            throw new IllegalArgumentException("Arms mask out of range: " + mask);
        }
    }

    public static Arms of(int mask) {
        return new Arms(mask);
    }

    public Arms union(Arms other) {
        return new Arms(mask | other.mask);
    }

    public boolean has(int arm) {
        return (mask & arm) != 0;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    /**
     * Arm pointing from one cell to an adjacent cell.
     *
     * @param dx column step, -1, 0 or 1
     * @param dy row step, -1, 0 or 1
     * @return the arm, or 0 for no movement
     */
    public static int toward(int dx, int dy) {
        if (dy < 0) {
            return UP;
        }
        if (dy > 0) {
            return DOWN;
        }
        if (dx > 0) {
            return RIGHT;
        }
        if (dx < 0) {
            return LEFT;
        }
        return 0;
    }

    /**
     * Reads the arms of a glyph drawn with the given palette.
     *
     * @param glyph cell content
     * @param palette palette the canvas is painted with
     * @return arms, or empty if the glyph is not a line glyph
     */
    public static Optional<Arms> fromGlyph(char glyph, CharPalette palette) {
        BoxGlyphs g = palette.glyphs();
        if (palette == CharPalette.ASCII) {
            if (glyph == g.cross()) {
                return Optional.of(new Arms(UP | RIGHT | DOWN | LEFT));
            }
        } else {
            if (glyph == g.topLeft() || glyph == '╭') {
                return Optional.of(new Arms(RIGHT | DOWN));
            }
            if (glyph == g.topRight() || glyph == '╮') {
                return Optional.of(new Arms(LEFT | DOWN));
            }
            if (glyph == g.bottomLeft() || glyph == '╰') {
                return Optional.of(new Arms(UP | RIGHT));
            }
            if (glyph == g.bottomRight() || glyph == '╯') {
                return Optional.of(new Arms(UP | LEFT));
            }
            if (glyph == g.teeRight()) {
                return Optional.of(new Arms(UP | DOWN | RIGHT));
            }
            if (glyph == g.teeLeft()) {
                return Optional.of(new Arms(UP | DOWN | LEFT));
            }
            if (glyph == g.teeDown()) {
                return Optional.of(new Arms(LEFT | RIGHT | DOWN));
            }
            if (glyph == g.teeUp()) {
                return Optional.of(new Arms(LEFT | RIGHT | UP));
            }
            if (glyph == g.cross()) {
                return Optional.of(new Arms(UP | RIGHT | DOWN | LEFT));
            }
        }
        if (glyph == g.horizontal() || glyph == g.dottedHorizontal() || glyph == g.thickHorizontal()) {
            return Optional.of(new Arms(LEFT | RIGHT));
        }
        if (glyph == g.vertical() || glyph == g.dottedVertical() || glyph == g.thickVertical()) {
            return Optional.of(new Arms(UP | DOWN));
        }
        return Optional.empty();
    }

    /**
     * Maps these arms to a glyph. Straight runs use the stroke of the line style; corners and
     * junctions always use the solid glyphs of the palette.
     *
     * @param palette target palette
     * @param style stroke for straight runs
     * @return glyph for the cell
     */
    public char toGlyph(CharPalette palette, LineStyle style) {
        BoxGlyphs g = palette.glyphs();
        return switch (mask) {
            case 0 -> ' ';
            case UP, DOWN, UP | DOWN -> switch (style) {
                case SOLID -> g.vertical();
                case DOTTED -> g.dottedVertical();
                case THICK -> g.thickVertical();
            };
            case LEFT, RIGHT, LEFT | RIGHT -> switch (style) {
                case SOLID -> g.horizontal();
                case DOTTED -> g.dottedHorizontal();
                case THICK -> g.thickHorizontal();
            };
            case DOWN | RIGHT -> g.topLeft();
            case DOWN | LEFT -> g.topRight();
            case UP | RIGHT -> g.bottomLeft();
            case UP | LEFT -> g.bottomRight();
            case UP | DOWN | RIGHT -> g.teeRight();
            case UP | DOWN | LEFT -> g.teeLeft();
            case LEFT | RIGHT | DOWN -> g.teeDown();
            case LEFT | RIGHT | UP -> g.teeUp();
            default -> g.cross();
        };
    }

    public char toGlyph(CharPalette palette) {
        return toGlyph(palette, LineStyle.SOLID);
    }
}
