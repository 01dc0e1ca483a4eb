package com.textgraph.core.model;

import java.util.Locale;

/**
 * Overall flow direction of a diagram.
 */
public enum Direction {
    /** Top to bottom (also spelled {@code TB}) */
    TD,

    /** Bottom to top */
    BT,

    /** Left to right */
    LR,

    /** Right to left */
    RL;

    /**
     * Returns whether layers advance along the horizontal axis.
     *
     * @return true for LR and RL
     */
    public boolean isHorizontal() {
        return this == LR || this == RL;
    }

    /**
     * Parses a direction keyword. {@code TB} is accepted as an alias for {@code TD}.
     *
     * @param value keyword, case-insensitive
     * @return parsed direction
     * @throws IllegalArgumentException if the keyword is unknown
     */
    public static Direction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Direction must not be blank");
        }
        String key = value.trim().toUpperCase(Locale.ROOT);
        return switch (key) {
            case "TD", "TB" -> TD;
            case "BT" -> BT;
            case "LR" -> LR;
            case "RL" -> RL;
            default -> throw new IllegalArgumentException(
                "Unknown direction '" + value + "'; use LR, RL, TD, TB or BT");
        };
    }
}
