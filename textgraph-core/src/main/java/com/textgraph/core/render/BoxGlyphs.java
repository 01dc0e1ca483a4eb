package com.textgraph.core.render;

/**
 * The glyphs of one palette, or of one node shape drawn with that palette.
 *
 * @param topLeft top-left corner
 * @param topRight top-right corner
 * @param bottomLeft bottom-left corner
 * @param bottomRight bottom-right corner
 * @param horizontal horizontal line
 * @param vertical vertical line
 * @param teeRight junction with arms up, down and right
 * @param teeLeft junction with arms up, down and left
 * @param teeDown junction with arms left, right and down
 * @param teeUp junction with arms left, right and up
 * @param cross four-way junction
 * @param arrowRight arrowhead pointing right
 * @param arrowLeft arrowhead pointing left
 * @param arrowDown arrowhead pointing down
 * @param arrowUp arrowhead pointing up
 * @param dottedHorizontal horizontal dotted line
 * @param dottedVertical vertical dotted line
 * @param thickHorizontal horizontal thick line
 * @param thickVertical vertical thick line
 */
public record BoxGlyphs(
    char topLeft,
    char topRight,
    char bottomLeft,
    char bottomRight,
    char horizontal,
    char vertical,
    char teeRight,
    char teeLeft,
    char teeDown,
    char teeUp,
    char cross,
    char arrowRight,
    char arrowLeft,
    char arrowDown,
    char arrowUp,
    char dottedHorizontal,
    char dottedVertical,
    char thickHorizontal,
    char thickVertical
) {
    /**
     * Returns a copy with other corner glyphs.
     *
     * @param tl top-left
     * @param tr top-right
     * @param bl bottom-left
     * @param br bottom-right
     * @return glyph set with the corners replaced
     */
    public BoxGlyphs withCorners(char tl, char tr, char bl, char br) {
        return new BoxGlyphs(tl, tr, bl, br, horizontal, vertical, teeRight, teeLeft, teeDown, teeUp, cross,
            arrowRight, arrowLeft, arrowDown, arrowUp, dottedHorizontal, dottedVertical,
            thickHorizontal, thickVertical);
    }

    public BoxGlyphs withVertical(char side) {
        return new BoxGlyphs(topLeft, topRight, bottomLeft, bottomRight, horizontal, side, teeRight, teeLeft,
            teeDown, teeUp, cross, arrowRight, arrowLeft, arrowDown, arrowUp, dottedHorizontal, dottedVertical,
            thickHorizontal, thickVertical);
    }
}
