package com.orgchart.resolution.aggregation;

import com.orgchart.resolution.hierarchy.HierarchyNode;
import com.orgchart.resolution.hierarchy.HierarchyTree;

import java.util.List;
import java.util.Objects;

/**
 * Derived values of every node of a tree, addressed by node index.
 */
public final class AggregationResult {

    private final List<NodeAggregate> aggregates;

    AggregationResult(List<NodeAggregate> aggregates) {
        this.aggregates = List.copyOf(aggregates);
    }

    public NodeAggregate get(int nodeIndex) {
        Objects.checkIndex(nodeIndex, aggregates.size());
        return aggregates.get(nodeIndex);
    }

    public NodeAggregate get(HierarchyNode node) {
        return get(node.index());
    }

    public NodeAggregate root() {
        return get(HierarchyTree.ROOT_INDEX);
    }

    /**
     * Aggregates in node index order, i.e. tree pre-order.
     */
    public List<NodeAggregate> all() {
        return aggregates;
    }

    public int size() {
        return aggregates.size();
    }
}
