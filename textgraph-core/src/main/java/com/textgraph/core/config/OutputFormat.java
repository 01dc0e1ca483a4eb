package com.textgraph.core.config;

import java.util.Locale;

/**
 * Output formats a diagram can be rendered to.
 */
public enum OutputFormat {

    /** Box-drawing or ASCII text */
    TEXT("txt"),

    /** SVG document */
    SVG("svg");

    private final String fileExtension;

    OutputFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String fileExtension() {
        return fileExtension;
    }

    /**
     * Parses a format name, ignoring case.
     *
     * @param value {@code text} or {@code svg}
     * @return format
     * @throws IllegalArgumentException if the value names no format
     */
    public static OutputFormat parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Output format must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format: " + value + " (expected text or svg)", e);
        }
    }
}
