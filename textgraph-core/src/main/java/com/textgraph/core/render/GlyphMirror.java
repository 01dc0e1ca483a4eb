package com.textgraph.core.render;

import java.util.Map;

/**
 * Mirror images of direction-dependent glyphs.
 */
public final class GlyphMirror {

    private static final Map<Character, Character> TOP_BOTTOM = Map.ofEntries(
        Map.entry('▼', '▲'), Map.entry('▲', '▼'),
        Map.entry('v', '^'), Map.entry('^', 'v'),
        Map.entry('┌', '└'), Map.entry('└', '┌'),
        Map.entry('┐', '┘'), Map.entry('┘', '┐'),
        Map.entry('╭', '╰'), Map.entry('╰', '╭'),
        Map.entry('╮', '╯'), Map.entry('╯', '╮'),
        Map.entry('┬', '┴'), Map.entry('┴', '┬'),
        Map.entry('/', '\\'), Map.entry('\\', '/'));

    private static final Map<Character, Character> LEFT_RIGHT = Map.ofEntries(
        Map.entry('►', '◄'), Map.entry('◄', '►'),
        Map.entry('>', '<'), Map.entry('<', '>'),
        Map.entry('┌', '┐'), Map.entry('┐', '┌'),
        Map.entry('└', '┘'), Map.entry('┘', '└'),
        Map.entry('╭', '╮'), Map.entry('╮', '╭'),
        Map.entry('╰', '╯'), Map.entry('╯', '╰'),
        Map.entry('├', '┤'), Map.entry('┤', '├'),
        Map.entry('/', '\\'), Map.entry('\\', '/'),
        Map.entry('(', ')'), Map.entry(')', '('));

    private GlyphMirror() {
        // Utility class
    }

    /**
     * Glyph seen in a mirror placed along a horizontal axis (top and bottom swap).
     *
     * @param glyph original glyph
     * @return mirrored glyph, or the glyph itself if it is symmetric
     */
    public static char flipVertical(char glyph) {
        return TOP_BOTTOM.getOrDefault(glyph, glyph);
    }

    /**
     * Glyph seen in a mirror placed along a vertical axis (left and right swap).
     *
     * @param glyph original glyph
     * @return mirrored glyph, or the glyph itself if it is symmetric
     */
    public static char flipHorizontal(char glyph) {
        return LEFT_RIGHT.getOrDefault(glyph, glyph);
    }
}
