package com.textgraph.core.layout;

/**
 * What a vertex of the layout graph stands for.
 */
public enum VertexKind {
    /** A node of the input graph */
    REAL,

    /** Synthetic vertex splitting a multi-layer edge */
    DUMMY,

    /** Synthetic vertex standing in for a collapsed group */
    COMPOUND
}
