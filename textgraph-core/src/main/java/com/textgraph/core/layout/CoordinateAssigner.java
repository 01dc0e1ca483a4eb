package com.textgraph.core.layout;

import com.textgraph.core.model.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns layer/order indices into character boxes.
 *
 * <p>Placement happens in flow space, where layers are stacked top to bottom. For horizontal
 * directions box sizes are transposed into flow space first and the result is transposed back,
 * so the returned boxes are always in screen orientation (before any mirroring for BT or RL).
 *
 * <p>Steps:
 * <ol>
 *   <li>row height per layer is the tallest box in it, at least {@link LayoutConstants#NODE_HEIGHT};</li>
 *   <li>boxes are packed left to right with a fixed gap and each layer is centred under the widest;</li>
 *   <li>a top-down then a bottom-up sweep shifts whole layers toward the mean centre of their
 *       real neighbours in the adjacent layer, skipping shifts larger than the gap;</li>
 *   <li>everything is translated so the smallest x is 0.</li>
 * </ol>
 */
public class CoordinateAssigner {

    private static final Logger log = LoggerFactory.getLogger(CoordinateAssigner.class);

    private final int padding;

    public CoordinateAssigner(int padding) {
        this.padding = Math.max(0, padding);
    }

    /**
     * Places every vertex of the augmented graph.
     *
     * @param augmented layered graph
     * @param ordering vertex ids per layer
     * @param sizeOverrides screen-space sizes for vertices not sized from their label
     * @param direction flow direction
     * @return boxes keyed by vertex id, in layer then order sequence
     */
    public Map<String, LayoutNode> assign(AugmentedGraph augmented, List<List<String>> ordering,
                                          Map<String, BoxSize> sizeOverrides, Direction direction) {
        boolean horizontal = direction.isHorizontal();
        int nodeGap = horizontal ? LayoutConstants.V_GAP : LayoutConstants.H_GAP;
        int layerGap = horizontal ? LayoutConstants.H_GAP : LayoutConstants.V_GAP;
        LayoutGraph graph = augmented.graph();

        Map<String, BoxSize> flowSizes = new HashMap<>();
        for (List<String> layer : ordering) {
            for (String id : layer) {
                flowSizes.put(id, flowSize(graph.vertex(id), sizeOverrides.get(id), horizontal));
            }
        }

        List<Integer> layerY = new ArrayList<>();
        int y = 0;
        for (List<String> layer : ordering) {
            int rowHeight = LayoutConstants.NODE_HEIGHT;
            for (String id : layer) {
                rowHeight = Math.max(rowHeight, flowSizes.get(id).height());
            }
            layerY.add(y);
            y += rowHeight + layerGap;
        }

        List<Integer> layerWidths = new ArrayList<>();
        int widest = 0;
        for (List<String> layer : ordering) {
            int total = 0;
            for (String id : layer) {
                total += flowSizes.get(id).width();
            }
            total += Math.max(0, layer.size() - 1) * nodeGap;
            layerWidths.add(total);
            widest = Math.max(widest, total);
        }

        Map<String, int[]> boxes = new LinkedHashMap<>();
        for (int layer = 0; layer < ordering.size(); layer++) {
            int x = Math.max(0, widest / 2 - layerWidths.get(layer) / 2);
            for (String id : ordering.get(layer)) {
                BoxSize size = flowSizes.get(id);
                boxes.put(id, new int[] {x, layerY.get(layer), size.width(), size.height()});
                x += size.width() + nodeGap;
            }
        }

        for (int layer = 1; layer < ordering.size(); layer++) {
            alignLayer(ordering.get(layer), boxes, graph, true, nodeGap);
        }
        for (int layer = ordering.size() - 2; layer >= 0; layer--) {
            alignLayer(ordering.get(layer), boxes, graph, false, nodeGap);
        }

        int minX = boxes.values().stream().mapToInt(b -> b[0]).min().orElse(0);
        Map<String, LayoutNode> result = new LinkedHashMap<>();
        for (int layer = 0; layer < ordering.size(); layer++) {
            List<String> ids = ordering.get(layer);
            for (int order = 0; order < ids.size(); order++) {
                String id = ids.get(order);
                int[] b = boxes.get(id);
                LayoutVertex vertex = graph.vertex(id);
                LayoutNode node = new LayoutNode(id, vertex.label(), vertex.shape(), vertex.kind(),
                    layer, order, b[0] - minX, b[1], b[2], b[3], null);
                result.put(id, horizontal ? node.transposed() : node);
            }
        }

        log.debug("Placed {} boxes in {} layers (direction {})", result.size(), ordering.size(), direction);
        return result;
    }

    private BoxSize flowSize(LayoutVertex vertex, BoxSize override, boolean horizontal) {
        if (vertex.isDummy()) {
            return new BoxSize(1, LayoutConstants.NODE_HEIGHT);
        }
        BoxSize screen = override != null ? override : BoxSize.forLabel(vertex.label(), padding);
        return horizontal ? screen.transposed() : screen;
    }

    /**
     * Shifts one layer toward its real neighbours in the adjacent, already placed layer.
     */
    private static void alignLayer(List<String> layer, Map<String, int[]> boxes, LayoutGraph graph,
                                   boolean towardPredecessors, int nodeGap) {
        if (layer.isEmpty()) {
            return;
        }
        long sumOwn = 0;
        long sumNeighbour = 0;
        int count = 0;
        for (String id : layer) {
            int[] own = boxes.get(id);
            List<String> neighbours = towardPredecessors ? graph.predecessors(id) : graph.successors(id);
            for (String neighbourId : neighbours) {
                if (graph.vertex(neighbourId).isDummy()) {
                    continue;
                }
                int[] neighbour = boxes.get(neighbourId);
                sumOwn += own[0] + own[2] / 2;
                sumNeighbour += neighbour[0] + neighbour[2] / 2;
                count++;
            }
        }
        if (count == 0) {
            return;
        }
        int shift = (int) (sumNeighbour / count - sumOwn / count);
        if (Math.abs(shift) > nodeGap) {
            return;
        }
        int layerMinX = Integer.MAX_VALUE;
        for (String id : layer) {
            layerMinX = Math.min(layerMinX, boxes.get(id)[0]);
        }
        shift = Math.max(shift, -layerMinX);
        for (String id : layer) {
            boxes.get(id)[0] += shift;
        }
    }
}
