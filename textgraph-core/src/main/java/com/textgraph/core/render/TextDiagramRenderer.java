package com.textgraph.core.render;

import com.textgraph.core.layout.LayoutNode;
import com.textgraph.core.layout.LayoutResult;
import com.textgraph.core.layout.Point;
import com.textgraph.core.layout.RoutedEdge;
import com.textgraph.core.model.Direction;
import com.textgraph.core.model.EdgeType;
import com.textgraph.core.model.LineStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Paints a {@link LayoutResult} onto a {@link Canvas} and returns the text.
 *
 * <p>Paint order: group borders, node outlines, edge lines (merged cell by cell so bends and
 * crossings get corner and junction glyphs), arrowheads. BT diagrams are then mirrored top to
 * bottom and RL diagrams left to right. Text (node labels, group titles and descriptions,
 * edge labels) is written last, at the mirrored position, so it always reads left to right.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TextDiagramRenderer renderer = new TextDiagramRenderer(CharPalette.UNICODE);
 * String text = renderer.render(layout);
 * }</pre>
 */
public class TextDiagramRenderer {

    private static final Logger log = LoggerFactory.getLogger(TextDiagramRenderer.class);

    private final CharPalette palette;

    public TextDiagramRenderer(CharPalette palette) {
        this.palette = Objects.requireNonNull(palette, "palette must not be null");
    }

    /**
     * Renders a layout.
     *
     * @param layout placed boxes and routed edges
     * @return diagram text ending in a newline, or an empty string for an empty layout
     */
    public String render(LayoutResult layout) {
        Objects.requireNonNull(layout, "layout must not be null");
        if (layout.isEmpty()) {
            return "";
        }

        int width = layout.width();
        int height = layout.height();
        List<EdgeLabel> labels = placeLabels(layout, height);
        for (EdgeLabel label : labels) {
            width = Math.max(width, label.to() + 1);
        }
        Canvas canvas = new Canvas(width, height, palette);
        log.debug("Painting {}x{} canvas with {} palette", width, height, palette);

        for (LayoutNode node : layout.nodes()) {
            if (node.isCompound()) {
                canvas.drawBox(node.x(), node.y(), node.width(), node.height(), palette.glyphs());
            }
        }
        for (LayoutNode node : layout.nodes()) {
            if (!node.isCompound()) {
                canvas.drawBox(node.x(), node.y(), node.width(), node.height(), palette.forShape(node.shape()));
            }
        }
        for (RoutedEdge edge : layout.edges()) {
            paintLines(canvas, edge.waypoints(), edge.type().lineStyle());
        }
        for (RoutedEdge edge : layout.edges()) {
            paintArrowheads(canvas, edge);
        }

        Mirror mirror = new Mirror(layout.direction(), width, height);
        if (mirror.vertical) {
            canvas.mirrorVertically();
        } else if (mirror.horizontal) {
            canvas.mirrorHorizontally();
        }

        for (LayoutNode node : layout.nodes()) {
            if (node.isCompound()) {
                paintGroupText(canvas, node, mirror);
            } else {
                paintNodeLabel(canvas, node, mirror);
            }
        }
        for (EdgeLabel label : labels) {
            mirror.write(canvas, label.from(), label.row(), label.text());
        }
        return canvas.toText();
    }

    /**
     * Picks a start cell for every edge label, in layout space.
     *
     * <p>The preferred cell is the row above the label anchor. If the text would cover a box,
     * a group outline or an earlier label, the row below is tried, then columns further and
     * further from the anchor on both rows. Without a clear spot the label keeps the preferred
     * cell.
     */
    private static List<EdgeLabel> placeLabels(LayoutResult layout, int height) {
        List<EdgeLabel> placed = new ArrayList<>();
        for (RoutedEdge edge : layout.edges()) {
            Point anchor = edge.labelAnchor();
            if (edge.label() == null || edge.label().isEmpty() || anchor == null) {
                continue;
            }
            int length = edge.label().length();
            Point at = findClearSpot(layout.nodes(), placed, anchor, length, height);
            if (at == null) {
                at = new Point(anchor.x(), Math.max(0, anchor.y() - 1));
            }
            placed.add(new EdgeLabel(edge.label(), at.x(), at.y()));
        }
        return placed;
    }

    private static Point findClearSpot(List<LayoutNode> nodes, List<EdgeLabel> taken, Point anchor,
                                       int length, int height) {
        int[] rows = {anchor.y() - 1, anchor.y() + 1};
        for (int shift = 0; shift <= length; shift++) {
            for (int row : rows) {
                if (row < 0 || row >= height) {
                    continue;
                }
                for (int col : new int[] {anchor.x() - shift, anchor.x() + shift}) {
                    if (col >= 0 && isClear(nodes, taken, col, col + length - 1, row)) {
                        return new Point(col, row);
                    }
                }
            }
        }
        return null;
    }

    private static boolean isClear(List<LayoutNode> nodes, List<EdgeLabel> taken, int from, int to, int row) {
        for (EdgeLabel label : taken) {
            if (label.row() == row && from <= label.to() && label.from() <= to) {
                return false;
            }
        }
        for (LayoutNode node : nodes) {
            if (node.isDummy() || row < node.y() || row > node.bottom() || to < node.x() || from > node.right()) {
                continue;
            }
            if (!node.isCompound()) {
                return false;
            }
            boolean onFrameRow = row == node.y() || row == node.bottom();
            boolean onFrameColumn = (from <= node.x() && node.x() <= to) || (from <= node.right() && node.right() <= to);
            if (onFrameRow || onFrameColumn) {
                return false;
            }
        }
        return true;
    }

    private static void paintLines(Canvas canvas, List<Point> waypoints, LineStyle style) {
        for (int i = 0; i + 1 < waypoints.size(); i++) {
            Point from = waypoints.get(i);
            Point to = waypoints.get(i + 1);
            int dx = Integer.signum(to.x() - from.x());
            int dy = Integer.signum(to.y() - from.y());
            int forward = Arms.toward(dx, dy);
            int backward = Arms.toward(-dx, -dy);
            int x = from.x();
            int y = from.y();
            while (x != to.x() || y != to.y()) {
                canvas.mergeArms(x, y, Arms.of(forward), style);
                x += dx;
                y += dy;
                canvas.mergeArms(x, y, Arms.of(backward), style);
            }
        }
    }

    private void paintArrowheads(Canvas canvas, RoutedEdge edge) {
        List<Point> points = edge.waypoints();
        if (points.size() < 2) {
            return;
        }
        EdgeType type = edge.type();
        if (type.hasArrowAtEnd()) {
            Point last = points.get(points.size() - 1);
            canvas.put(last.x(), last.y(), arrow(points.get(points.size() - 2), last));
        }
        if (type.isBidirectional()) {
            Point first = points.get(0);
            canvas.put(first.x(), first.y(), arrow(points.get(1), first));
        }
    }

    private char arrow(Point from, Point tip) {
        BoxGlyphs g = palette.glyphs();
        if (tip.y() > from.y()) {
            return g.arrowDown();
        }
        if (tip.y() < from.y()) {
            return g.arrowUp();
        }
        return tip.x() > from.x() ? g.arrowRight() : g.arrowLeft();
    }

    private static void paintNodeLabel(Canvas canvas, LayoutNode node, Mirror mirror) {
        int x = mirror.horizontal ? mirror.width - node.x() - node.width() : node.x();
        int y = mirror.vertical ? mirror.height - node.y() - node.height() : node.y();
        int inner = Math.max(0, node.width() - 2);
        String[] lines = node.label().split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int pad = Math.max(0, inner - line.length()) / 2;
            canvas.writeText(x + 1 + pad, y + 1 + i, line);
        }
    }

    private static void paintGroupText(Canvas canvas, LayoutNode node, Mirror mirror) {
        int inner = Math.max(0, node.width() - 2);
        String title = node.label();
        mirror.write(canvas, node.x() + 1 + Math.max(0, inner - title.length()) / 2, node.y() + 1, title);
        String description = node.description();
        if (description != null && !description.isEmpty()) {
            mirror.write(canvas, node.x() + 1 + Math.max(0, inner - description.length()) / 2,
                node.y() + node.height() - 2, description);
        }
    }

    /**
     * Edge label text and its first cell in layout space.
     */
    private record EdgeLabel(String text, int from, int row) {

        int to() {
            return from + text.length() - 1;
        }
    }

    /**
     * Maps text positions from layout space to the mirrored canvas.
     */
    private static final class Mirror {

        private final boolean vertical;
        private final boolean horizontal;
        private final int width;
        private final int height;

        Mirror(Direction direction, int width, int height) {
            this.vertical = direction == Direction.BT;
            this.horizontal = direction == Direction.RL;
            this.width = width;
            this.height = height;
        }

        void write(Canvas canvas, int x, int y, String text) {
            int col = horizontal ? width - x - text.length() : x;
            int row = vertical ? height - 1 - y : y;
            canvas.writeText(Math.max(0, col), row, text);
        }
    }
}
