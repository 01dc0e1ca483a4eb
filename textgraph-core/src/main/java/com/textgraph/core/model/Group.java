package com.textgraph.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named group (subgraph) of nodes, possibly containing nested groups.
 *
 * @param name group name, also used as its title
 * @param members ordered ids of the nodes declared directly in this group
 * @param groups nested groups
 * @param description optional one-line description
 */
public record Group(
    String name,
    List<String> members,
    List<Group> groups,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public Group {
        Objects.requireNonNull(name, "name must not be null");
        members = members == null ? List.of() : List.copyOf(members);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    /**
     * Creates a group without nested groups or description.
     *
     * @param name group name
     * @param members member node ids
     * @return new group
     */
    public static Group of(String name, List<String> members) {
        return new Group(name, members, List.of(), null);
    }

    /**
     * Returns member ids of this group and all nested groups, depth first, without duplicates.
     *
     * @return recursively collected member ids
     */
    public List<String> allMembers() {
        List<String> result = new ArrayList<>();
        collectMembers(this, result);
        return result;
    }

    private static void collectMembers(Group group, List<String> out) {
        for (String member : group.members()) {
            if (!out.contains(member)) {
                out.add(member);
            }
        }
        for (Group nested : group.groups()) {
            collectMembers(nested, out);
        }
    }
}
