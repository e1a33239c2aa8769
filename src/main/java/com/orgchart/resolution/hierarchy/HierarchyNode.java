package com.orgchart.resolution.hierarchy;

import com.orgchart.resolution.core.model.EntityRecord;

import java.util.List;
import java.util.Objects;

/**
 * A node of a {@link HierarchyTree}. Parent and children are indices into the tree's arena.
 *
 * @param index        position of the node in the tree
 * @param record       the entity record
 * @param parentIndex  index of the parent, or -1 for the root
 * @param childIndices indices of the children, in display order
 * @param synthetic    true for a root fabricated because the input had none
 * @param resolution   how the parent was found
 */
public record HierarchyNode(
        int index,
        EntityRecord record,
        int parentIndex,
        List<Integer> childIndices,
        boolean synthetic,
        ParentResolution resolution
) {
    public static final int NO_PARENT = -1;

    public HierarchyNode {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(resolution, "resolution is required");
        childIndices = childIndices == null ? List.of() : List.copyOf(childIndices);
    }

    public String name() {
        return record.name();
    }

    public int orgLevel() {
        return record.orgLevel();
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    public boolean isLeaf() {
        return childIndices.isEmpty();
    }
}
