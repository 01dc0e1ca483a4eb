package com.textgraph.core.render;

import com.textgraph.core.model.NodeShape;

/**
 * Character palettes a diagram can be painted with.
 */
public enum CharPalette {

    /** Unicode box-drawing characters */
    UNICODE(new BoxGlyphs(
        '┌', '┐', '└', '┘', '─', '│',
        '├', '┤', '┬', '┴', '┼',
        '►', '◄', '▼', '▲',
        '╌', '╎', '═', '║')),

    /** Plain 7-bit ASCII */
    ASCII(new BoxGlyphs(
        '+', '+', '+', '+', '-', '|',
        '+', '+', '+', '+', '+',
        '>', '<', 'v', '^',
        '.', ':', '=', '|'));

    private final BoxGlyphs glyphs;

    CharPalette(BoxGlyphs glyphs) {
        this.glyphs = glyphs;
    }

    public BoxGlyphs glyphs() {
        return glyphs;
    }

    /**
     * Glyphs for the outline of a node shape.
     *
     * <ul>
     *   <li>rounded: arc corners (plain corners in ASCII)</li>
     *   <li>diamond: slashes in the corners</li>
     *   <li>circle: parentheses in the corners and blank sides</li>
     * </ul>
     *
     * @param shape node shape
     * @return outline glyphs
     */
    public BoxGlyphs forShape(NodeShape shape) {
        return switch (shape) {
            case RECTANGLE -> glyphs;
            case ROUNDED -> this == ASCII ? glyphs : glyphs.withCorners('╭', '╮', '╰', '╯');
            case DIAMOND -> glyphs.withCorners('/', '\\', '\\', '/');
            case CIRCLE -> glyphs.withCorners('(', ')', '(', ')').withVertical(' ');
        };
    }

    public static CharPalette of(boolean unicode) {
        return unicode ? UNICODE : ASCII;
    }
}
