package com.textgraph.core.layout.group;

import com.textgraph.core.layout.LayoutConstants;
import com.textgraph.core.layout.LayoutNode;
import com.textgraph.core.layout.VertexKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Places group members inside the compound boxes chosen by the outer layout.
 *
 * <p>Members sit in one row below the title, left to right, separated by
 * {@link LayoutConstants#GROUP_INNER_GAP}. Nested groups are expanded the same way inside
 * their own box. Every member takes over the layer and order of the top-level compound.
 */
public class GroupExpander {

    /**
     * Expands all compounds.
     *
     * @param collapsed collapse result
     * @param placed boxes from the outer layout, keyed by vertex id
     * @return the placed boxes plus one box per group member, compounds before their members
     */
    public Map<String, LayoutNode> expand(CollapsedGraph collapsed, Map<String, LayoutNode> placed) {
        Map<String, LayoutNode> result = new LinkedHashMap<>();
        Map<String, CompoundBox> compounds = new LinkedHashMap<>();
        for (CompoundBox compound : collapsed.compounds()) {
            compounds.put(compound.id(), compound);
        }
        for (LayoutNode node : placed.values()) {
            CompoundBox compound = compounds.get(node.id());
            if (compound == null) {
                result.put(node.id(), node);
            } else {
                placeCompound(compound, node, node.layer(), node.order(), result);
            }
        }
        return result;
    }

    private static void placeCompound(CompoundBox compound, LayoutNode box, int layer, int order,
                                      Map<String, LayoutNode> out) {
        out.put(compound.id(), box.withDescription(compound.description()));
        int x = box.x() + 1 + LayoutConstants.GROUP_PAD_X;
        int y = box.y() + CompoundBox.HEADER_ROWS;
        for (CompoundMember member : compound.members()) {
            int width = member.size().width();
            int height = member.size().height();
            if (member.isGroup()) {
                LayoutNode nestedBox = new LayoutNode(member.id(), member.label(), member.shape(),
                    VertexKind.COMPOUND, layer, order, x, y, width, height, null);
                placeCompound(member.nested(), nestedBox, layer, order, out);
            } else {
                out.put(member.id(), new LayoutNode(member.id(), member.label(), member.shape(),
                    VertexKind.REAL, layer, order, x, y, width, height, null));
            }
            x += width + LayoutConstants.GROUP_INNER_GAP;
        }
    }
}
