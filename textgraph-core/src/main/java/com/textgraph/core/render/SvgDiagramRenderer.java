package com.textgraph.core.render;

import com.textgraph.core.layout.LayoutNode;
import com.textgraph.core.layout.LayoutResult;
import com.textgraph.core.layout.Point;
import com.textgraph.core.layout.RoutedEdge;
import com.textgraph.core.model.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link LayoutResult} as an SVG document.
 *
 * <p>The character grid of the layout is scaled to pixels, one cell being
 * {@value #CELL_W}x{@value #CELL_H}. Group boxes are drawn as dashed frames, edges as
 * polylines through the centres of their waypoint cells with arrow markers, and nodes on top
 * of the edges with their shape. BT and RL layouts are mirrored by coordinate, so text keeps
 * reading left to right.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String svg = new SvgDiagramRenderer().render(layout);
 * Files.writeString(Path.of("flow.svg"), svg, StandardCharsets.UTF_8);
 * }</pre>
 */
public class SvgDiagramRenderer {

    private static final Logger log = LoggerFactory.getLogger(SvgDiagramRenderer.class);

    static final int CELL_W = 10;
    static final int CELL_H = 20;
    static final int MARGIN = 20;

    private static final int FONT_SIZE = 14;
    private static final int LABEL_FONT_SIZE = 12;
    private static final String FONT = "font-family=\"monospace\"";
    private static final String NODE_STYLE = "fill=\"white\" stroke=\"black\" stroke-width=\"1.5\"";
    private static final String GROUP_STYLE = "fill=\"none\" stroke=\"#888\" stroke-width=\"1\" stroke-dasharray=\"4 2\"";

    /**
     * Renders a layout.
     *
     * @param layout placed boxes and routed edges
     * @return SVG document ending in a newline, or an empty string for an empty layout
     */
    public String render(LayoutResult layout) {
        Objects.requireNonNull(layout, "layout must not be null");
        if (layout.isEmpty()) {
            return "";
        }

        Frame frame = new Frame(layout.direction(), layout.width(), layout.height());
        int svgWidth = 2 * MARGIN + frame.width * CELL_W;
        int svgHeight = 2 * MARGIN + frame.height * CELL_H;
        log.debug("Writing {}x{} SVG for {} boxes and {} edges",
            svgWidth, svgHeight, layout.nodes().size(), layout.edges().size());

        StringBuilder svg = new StringBuilder();
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(svgWidth)
            .append("\" height=\"").append(svgHeight)
            .append("\" viewBox=\"0 0 ").append(svgWidth).append(' ').append(svgHeight).append("\">\n");
        appendDefs(svg);
        svg.append("<rect width=\"").append(svgWidth).append("\" height=\"").append(svgHeight)
            .append("\" fill=\"white\"/>\n");

        for (LayoutNode node : layout.nodes()) {
            if (node.isCompound()) {
                appendGroup(svg, frame.box(node));
            }
        }
        for (RoutedEdge edge : layout.edges()) {
            appendEdge(svg, edge, frame);
        }
        for (LayoutNode node : layout.nodes()) {
            if (!node.isCompound() && !node.isDummy()) {
                appendNode(svg, frame.box(node));
            }
        }

        svg.append("</svg>\n");
        return svg.toString();
    }

    private static void appendDefs(StringBuilder svg) {
        svg.append("<defs>\n")
            .append("  <marker id=\"arrowhead\" markerWidth=\"10\" markerHeight=\"7\" refX=\"10\" refY=\"3.5\" orient=\"auto\">\n")
            .append("    <polygon points=\"0 0, 10 3.5, 0 7\" fill=\"black\"/>\n")
            .append("  </marker>\n")
            .append("  <marker id=\"arrowhead-rev\" markerWidth=\"10\" markerHeight=\"7\" refX=\"0\" refY=\"3.5\" orient=\"auto\">\n")
            .append("    <polygon points=\"10 0, 0 3.5, 10 7\" fill=\"black\"/>\n")
            .append("  </marker>\n")
            .append("</defs>\n");
    }

    private static void appendGroup(StringBuilder svg, LayoutNode box) {
        int x = px(box.x());
        int y = py(box.y());
        svg.append("<rect x=\"").append(x).append("\" y=\"").append(y)
            .append("\" width=\"").append(box.width() * CELL_W)
            .append("\" height=\"").append(box.height() * CELL_H)
            .append("\" ").append(GROUP_STYLE).append("/>\n");
        int centerX = x + box.width() * CELL_W / 2;
        appendText(svg, centerX, py(box.y() + 1) + CELL_H / 2, LABEL_FONT_SIZE, "#666", box.label());
        String description = box.description();
        if (description != null && !description.isEmpty()) {
            appendText(svg, centerX, py(box.bottom() - 1) + CELL_H / 2, LABEL_FONT_SIZE, "#666", description);
        }
    }

    private static void appendNode(StringBuilder svg, LayoutNode box) {
        int x = px(box.x());
        int y = py(box.y());
        int w = box.width() * CELL_W;
        int h = box.height() * CELL_H;
        int cx = x + w / 2;
        int cy = y + h / 2;

        switch (box.shape()) {
            case ROUNDED -> svg.append("<rect x=\"").append(x).append("\" y=\"").append(y)
                .append("\" width=\"").append(w).append("\" height=\"").append(h)
                .append("\" rx=\"").append(Math.min(w, h) / 4).append("\" ").append(NODE_STYLE).append("/>\n");
            case DIAMOND -> svg.append("<polygon points=\"")
                .append(cx).append(',').append(y).append(' ')
                .append(x + w).append(',').append(cy).append(' ')
                .append(cx).append(',').append(y + h).append(' ')
                .append(x).append(',').append(cy)
                .append("\" ").append(NODE_STYLE).append("/>\n");
            case CIRCLE -> svg.append("<ellipse cx=\"").append(cx).append("\" cy=\"").append(cy)
                .append("\" rx=\"").append(w / 2).append("\" ry=\"").append(h / 2)
                .append("\" ").append(NODE_STYLE).append("/>\n");
            case RECTANGLE -> svg.append("<rect x=\"").append(x).append("\" y=\"").append(y)
                .append("\" width=\"").append(w).append("\" height=\"").append(h)
                .append("\" ").append(NODE_STYLE).append("/>\n");
        }

        String[] lines = box.label().split("\n", -1);
        if (lines.length == 1) {
            svg.append("<text x=\"").append(cx).append("\" y=\"").append(cy)
                .append("\" dominant-baseline=\"central\" text-anchor=\"middle\" ")
                .append(FONT).append(" font-size=\"").append(FONT_SIZE).append("\">")
                .append(escape(lines[0])).append("</text>\n");
            return;
        }
        int lineHeight = FONT_SIZE + 2;
        int firstY = cy - lines.length * lineHeight / 2 + FONT_SIZE / 2;
        svg.append("<text text-anchor=\"middle\" ").append(FONT).append(" font-size=\"").append(FONT_SIZE).append("\">");
        for (int i = 0; i < lines.length; i++) {
            svg.append("<tspan x=\"").append(cx).append("\" y=\"").append(firstY + i * lineHeight).append("\">")
                .append(escape(lines[i])).append("</tspan>");
        }
        svg.append("</text>\n");
    }

    private static void appendEdge(StringBuilder svg, RoutedEdge edge, Frame frame) {
        List<Point> points = frame.points(edge.waypoints());
        if (points.size() < 2) {
            return;
        }

        StringBuilder coords = new StringBuilder();
        for (int i = 0; i < points.size(); i++) {
            int x = centerX(points.get(i).x());
            int y = centerY(points.get(i).y());
            // ends reach the box borders, half a cell beyond the end cells
            if (i == 0) {
                x -= Integer.signum(points.get(1).x() - points.get(0).x()) * CELL_W / 2;
                y -= Integer.signum(points.get(1).y() - points.get(0).y()) * CELL_H / 2;
            } else if (i == points.size() - 1) {
                x += Integer.signum(points.get(i).x() - points.get(i - 1).x()) * CELL_W / 2;
                y += Integer.signum(points.get(i).y() - points.get(i - 1).y()) * CELL_H / 2;
            }
            if (i > 0) {
                coords.append(' ');
            }
            coords.append(x).append(',').append(y);
        }

        String stroke = switch (edge.type().lineStyle()) {
            case SOLID -> "stroke-width=\"1.5\"";
            case DOTTED -> "stroke-width=\"1.5\" stroke-dasharray=\"6 4\"";
            case THICK -> "stroke-width=\"3\"";
        };
        svg.append("<polyline points=\"").append(coords).append("\" fill=\"none\" stroke=\"black\" ").append(stroke);
        if (edge.type().hasArrowAtEnd()) {
            svg.append(" marker-end=\"url(#arrowhead)\"");
        }
        if (edge.type().isBidirectional()) {
            svg.append(" marker-start=\"url(#arrowhead-rev)\"");
        }
        svg.append("/>\n");

        Point anchor = edge.labelAnchor();
        if (edge.label() != null && !edge.label().isEmpty() && anchor != null) {
            Point mirrored = frame.point(anchor);
            appendText(svg, centerX(mirrored.x()), py(mirrored.y()) - 4, LABEL_FONT_SIZE, "#333", edge.label());
        }
    }

    private static void appendText(StringBuilder svg, int x, int y, int size, String fill, String text) {
        svg.append("<text x=\"").append(x).append("\" y=\"").append(y)
            .append("\" text-anchor=\"middle\" ").append(FONT)
            .append(" font-size=\"").append(size).append("\" fill=\"").append(fill).append("\">")
            .append(escape(text)).append("</text>\n");
    }

    static String escape(String text) {
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }

    private static int px(int column) {
        return MARGIN + column * CELL_W;
    }

    private static int py(int row) {
        return MARGIN + row * CELL_H;
    }

    private static int centerX(int column) {
        return px(column) + CELL_W / 2;
    }

    private static int centerY(int row) {
        return py(row) + CELL_H / 2;
    }

    /**
     * Grid extent plus the BT/RL mirror applied to boxes and points.
     */
    private static final class Frame {

        private final boolean vertical;
        private final boolean horizontal;
        private final int width;
        private final int height;

        Frame(Direction direction, int width, int height) {
            this.vertical = direction == Direction.BT;
            this.horizontal = direction == Direction.RL;
            this.width = width;
            this.height = height;
        }

        LayoutNode box(LayoutNode node) {
            int x = horizontal ? width - node.x() - node.width() : node.x();
            int y = vertical ? height - node.y() - node.height() : node.y();
            return node.at(Math.max(0, x), Math.max(0, y));
        }

        Point point(Point point) {
            return new Point(horizontal ? width - 1 - point.x() : point.x(),
                vertical ? height - 1 - point.y() : point.y());
        }

        List<Point> points(List<Point> points) {
            return points.stream().map(this::point).toList();
        }
    }
}
