package com.textgraph.core.model;

/**
 * The nine connector variants of a flowchart edge.
 *
 * <p>Each constant carries the connector token used in the source language, the stroke it
 * is painted with, and where arrowheads go.
 */
public enum EdgeType {
    /** {@code -->} */
    ARROW("-->", LineStyle.SOLID, true, false),

    /** {@code ---} */
    LINE("---", LineStyle.SOLID, false, false),

    /** {@code -.->} */
    DOTTED_ARROW("-.->", LineStyle.DOTTED, true, false),

    /** {@code -.-} */
    DOTTED_LINE("-.-", LineStyle.DOTTED, false, false),

    /** {@code ==>} */
    THICK_ARROW("==>", LineStyle.THICK, true, false),

    /** {@code ===} */
    THICK_LINE("===", LineStyle.THICK, false, false),

    /** {@code <-->} */
    BIDIR_ARROW("<-->", LineStyle.SOLID, true, true),

    /** {@code <-.->} */
    BIDIR_DOTTED("<-.->", LineStyle.DOTTED, true, true),

    /** {@code <==>} */
    BIDIR_THICK("<==>", LineStyle.THICK, true, true);

    private final String token;
    private final LineStyle lineStyle;
    private final boolean arrowAtEnd;
    private final boolean bidirectional;

    EdgeType(String token, LineStyle lineStyle, boolean arrowAtEnd, boolean bidirectional) {
        this.token = token;
        this.lineStyle = lineStyle;
        this.arrowAtEnd = arrowAtEnd;
        this.bidirectional = bidirectional;
    }

    public String token() {
        return token;
    }

    public LineStyle lineStyle() {
        return lineStyle;
    }

    /**
     * Returns whether the target end of the edge gets an arrowhead.
     *
     * @return true for arrow and bidirectional variants
     */
    public boolean hasArrowAtEnd() {
        return arrowAtEnd;
    }

    /**
     * Returns whether the source end also gets an arrowhead.
     *
     * @return true for the three bidirectional variants
     */
    public boolean isBidirectional() {
        return bidirectional;
    }
}
