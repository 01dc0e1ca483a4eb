package com.textgraph.core.layout.group;

import com.textgraph.core.layout.BoxSize;
import com.textgraph.core.layout.LayoutConstants;

import java.util.List;
import java.util.Objects;

/**
 * Box standing in for a group, together with the boxes it encloses.
 *
 * <p>Inside the border the first row holds the title, the second is blank, the members follow
 * in one row, and an optional description takes the row above the bottom border.
 *
 * @param id compound vertex id
 * @param name group name, drawn as title
 * @param description optional description
 * @param members enclosed boxes, left to right
 * @param size outer size
 */
public record CompoundBox(String id, String name, String description, List<CompoundMember> members, BoxSize size) {

    /** Rows above the member row: top border, title, spacer. */
    public static final int HEADER_ROWS = 3;

    /**
     * Compact constructor with validation.
     */
    public CompoundBox {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(size, "size must not be null");
        members = members == null ? List.of() : List.copyOf(members);
    }

    /**
     * Sizes a group box around its members, title and description.
     *
     * @param id compound id
     * @param name group name
     * @param description optional description
     * @param members enclosed boxes
     * @return sized box
     */
    public static CompoundBox of(String id, String name, String description, List<CompoundMember> members) {
        int content = 0;
        int tallest = 0;
        for (CompoundMember member : members) {
            content += member.size().width();
            tallest = Math.max(tallest, member.size().height());
        }
        content += Math.max(0, members.size() - 1) * LayoutConstants.GROUP_INNER_GAP;
        int inner = Math.max(content, name.length() + 4);
        boolean hasDescription = description != null && !description.isEmpty();
        if (hasDescription) {
            inner = Math.max(inner, description.length() + 4);
        }
        int width = 2 + 2 * LayoutConstants.GROUP_PAD_X + inner;
        int descriptionRows = hasDescription ? 1 : 0;
        int height = members.isEmpty()
            ? 3 + descriptionRows
            : HEADER_ROWS + tallest + descriptionRows + 1;
        return new CompoundBox(id, name, description, members, new BoxSize(width, height));
    }
}
