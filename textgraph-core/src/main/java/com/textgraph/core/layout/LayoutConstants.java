package com.textgraph.core.layout;

/**
 * Geometry constants shared by the layout stages, in character cells.
 */
public final class LayoutConstants {

    /** Default horizontal padding inside a node box on each side of the label. */
    public static final int DEFAULT_PADDING = 1;

    /** Gap between neighbouring boxes of one layer. */
    public static final int H_GAP = 4;

    /** Gap between consecutive layers. */
    public static final int V_GAP = 3;

    /** Minimum row height, also the height of a single-line node. */
    public static final int NODE_HEIGHT = 3;

    /** Gap between member boxes inside an expanded group. */
    public static final int GROUP_INNER_GAP = 3;

    /** Columns between a group border and its content. */
    public static final int GROUP_PAD_X = 1;

    /** Upper bound on barycenter sweep passes. */
    public static final int MAX_ORDERING_PASSES = 24;

    public static final String DUMMY_PREFIX = "__dummy_";
    public static final String COMPOUND_PREFIX = "__sg_";

    private LayoutConstants() {
        // Utility class
    }
}
