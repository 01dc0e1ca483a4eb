package com.textgraph.core.model;

/**
 * Stroke used when painting an edge.
 */
public enum LineStyle {
    SOLID,
    DOTTED,
    THICK
}
