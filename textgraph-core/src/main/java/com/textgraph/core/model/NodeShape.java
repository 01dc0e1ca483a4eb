package com.textgraph.core.model;

/**
 * Outline drawn around a node label.
 */
public enum NodeShape {
    /** {@code id[Label]} */
    RECTANGLE,

    /** {@code id(Label)} */
    ROUNDED,

    /** {@code id{Label}} */
    DIAMOND,

    /** {@code id((Label))} */
    CIRCLE
}
