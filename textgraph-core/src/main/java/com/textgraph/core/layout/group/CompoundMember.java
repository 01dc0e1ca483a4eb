package com.textgraph.core.layout.group;

import com.textgraph.core.layout.BoxSize;
import com.textgraph.core.model.NodeShape;

import java.util.Objects;

/**
 * One box laid out inside a group: either a node or a nested group.
 *
 * @param id node id or nested compound id
 * @param label display label
 * @param shape outline shape
 * @param size box size
 * @param nested nested group box, null for a plain node
 */
public record CompoundMember(String id, String label, NodeShape shape, BoxSize size, CompoundBox nested) {

    /**
     * Compact constructor with validation.
     */
    public CompoundMember {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(size, "size must not be null");
    }

    public boolean isGroup() {
        return nested != null;
    }
}
