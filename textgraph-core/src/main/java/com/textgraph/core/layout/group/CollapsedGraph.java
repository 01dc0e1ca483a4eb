package com.textgraph.core.layout.group;

import com.textgraph.core.layout.BoxSize;
import com.textgraph.core.layout.LayoutGraph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Layout graph with every top-level group folded into one compound vertex.
 *
 * @param graph graph the outer layout runs on
 * @param compounds top-level group boxes
 * @param layoutIds node id or group name to the outer-layout vertex that carries it
 * @param boxIds node id or group name to the id of the box drawn for it
 * @param enclosing box id to the ids of all compound boxes around it, innermost first
 */
public record CollapsedGraph(
    LayoutGraph graph,
    List<CompoundBox> compounds,
    Map<String, String> layoutIds,
    Map<String, String> boxIds,
    Map<String, List<String>> enclosing
) {
    /**
     * Compact constructor with validation.
     */
    public CollapsedGraph {
        Objects.requireNonNull(graph, "graph must not be null");
        compounds = compounds == null ? List.of() : List.copyOf(compounds);
        layoutIds = layoutIds == null ? Map.of() : Map.copyOf(layoutIds);
        boxIds = boxIds == null ? Map.of() : Map.copyOf(boxIds);
        enclosing = enclosing == null ? Map.of() : Map.copyOf(enclosing);
    }

    /**
     * Screen-space sizes of the compound vertices.
     *
     * @return size per compound id
     */
    public Map<String, BoxSize> sizeOverrides() {
        Map<String, BoxSize> result = new LinkedHashMap<>();
        for (CompoundBox compound : compounds) {
            result.put(compound.id(), compound.size());
        }
        return result;
    }

    public Optional<String> layoutId(String nodeOrGroup) {
        return Optional.ofNullable(layoutIds.get(nodeOrGroup));
    }

    public Optional<String> boxId(String nodeOrGroup) {
        return Optional.ofNullable(boxIds.get(nodeOrGroup));
    }

    /**
     * Returns whether one box lies inside the other.
     *
     * @param a box id
     * @param b box id
     * @return true if either encloses the other
     */
    public boolean isNested(String a, String b) {
        return enclosing.getOrDefault(a, List.of()).contains(b)
            || enclosing.getOrDefault(b, List.of()).contains(a);
    }
}
