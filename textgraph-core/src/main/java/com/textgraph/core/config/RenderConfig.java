package com.textgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.textgraph.core.layout.LayoutConstants;
import com.textgraph.core.layout.routing.GridEdgeRouter;
import com.textgraph.core.model.Direction;

/**
 * Rendering options.
 *
 * <p>Loaded from {@code textgraph.yaml} by {@link ConfigLoader}; command-line flags override
 * individual values through the {@code with*} methods.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * unicode: true
 * padding: 2
 * direction: LR
 * router: waypoint
 * format: svg
 * }</pre>
 *
 * @param unicode box-drawing glyphs when true, plain ASCII otherwise; defaults to true
 * @param padding spaces between a label and its box border; negative values clamp to 0
 * @param direction direction override applied before layout ({@code TD}, {@code TB}, {@code BT},
 *                  {@code LR}, {@code RL}), or null to keep the graph's own
 * @param router edge router id; defaults to {@code grid}
 * @param format {@code text} or {@code svg}; defaults to {@code text}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenderConfig(
    @JsonProperty("unicode") Boolean unicode,
    @JsonProperty("padding") Integer padding,
    @JsonProperty("direction") String direction,
    @JsonProperty("router") String router,
    @JsonProperty("format") String format
) {
    public RenderConfig {
        if (unicode == null) {
            unicode = Boolean.TRUE;
        }
        if (padding == null) {
            padding = LayoutConstants.DEFAULT_PADDING;
        } else if (padding < 0) {
            padding = 0;
        }
        if (direction != null) {
            direction = direction.isBlank() ? null : Direction.parse(direction).name();
        }
        if (router == null || router.isBlank()) {
            router = GridEdgeRouter.ID;
        }
        format = format == null || format.isBlank()
            ? OutputFormat.TEXT.name()
            : OutputFormat.parse(format).name();
    }

    /**
     * Default options: Unicode glyphs, padding 1, graph direction, grid router, text output.
     *
     * @return default configuration
     */
    public static RenderConfig defaults() {
        return new RenderConfig(null, null, null, null, null);
    }

    public boolean isUnicode() {
        return unicode;
    }

    /**
     * Returns the direction override.
     *
     * @return override, or null when the graph keeps its declared direction
     */
    public Direction directionOverride() {
        return direction == null ? null : Direction.valueOf(direction);
    }

    public OutputFormat outputFormat() {
        return OutputFormat.valueOf(format);
    }

    public RenderConfig withUnicode(boolean newUnicode) {
        return new RenderConfig(newUnicode, padding, direction, router, format);
    }

    public RenderConfig withPadding(int newPadding) {
        return new RenderConfig(unicode, newPadding, direction, router, format);
    }

    public RenderConfig withDirection(Direction newDirection) {
        return new RenderConfig(unicode, padding, newDirection == null ? null : newDirection.name(), router, format);
    }

    public RenderConfig withRouter(String newRouter) {
        return new RenderConfig(unicode, padding, direction, newRouter, format);
    }

    public RenderConfig withFormat(OutputFormat newFormat) {
        return new RenderConfig(unicode, padding, direction, router, newFormat == null ? null : newFormat.name());
    }
}
