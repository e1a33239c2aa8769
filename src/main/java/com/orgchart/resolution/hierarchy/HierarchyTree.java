package com.orgchart.resolution.hierarchy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable organization tree stored as an arena of nodes.
 * The root is at index 0 and nodes are laid out in pre-order, children in display order,
 * so iterating {@link #nodes()} in reverse visits every child before its parent.
 */
public final class HierarchyTree {

    public static final int ROOT_INDEX = 0;

    private final List<HierarchyNode> nodes;
    private final Map<String, Integer> indexByName;

    HierarchyTree(List<HierarchyNode> nodes) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("a tree has at least a root");
        }
        this.nodes = List.copyOf(nodes);
        Map<String, Integer> byName = new HashMap<>();
        for (HierarchyNode node : this.nodes) {
            byName.putIfAbsent(node.name(), node.index());
        }
        this.indexByName = Collections.unmodifiableMap(byName);
    }

    public HierarchyNode root() {
        return nodes.get(ROOT_INDEX);
    }

    public HierarchyNode node(int index) {
        Objects.checkIndex(index, nodes.size());
        return nodes.get(index);
    }

    /**
     * All nodes in pre-order.
     */
    public List<HierarchyNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public List<HierarchyNode> children(int index) {
        return node(index).childIndices().stream().map(nodes::get).toList();
    }

    public Optional<HierarchyNode> parent(int index) {
        HierarchyNode node = node(index);
        return node.isRoot() ? Optional.empty() : Optional.of(nodes.get(node.parentIndex()));
    }

    /**
     * The node followed by its ancestors, ending with the root.
     */
    public List<HierarchyNode> pathToRoot(int index) {
        List<HierarchyNode> path = new ArrayList<>();
        HierarchyNode current = node(index);
        path.add(current);
        while (!current.isRoot()) {
            current = nodes.get(current.parentIndex());
            path.add(current);
        }
        return Collections.unmodifiableList(path);
    }

    /**
     * Number of parent links between the node and the root.
     */
    public int depth(int index) {
        return pathToRoot(index).size() - 1;
    }

    /**
     * Finds a node by exact name; with duplicate names the first in pre-order wins.
     */
    public Optional<HierarchyNode> find(String name) {
        Integer index = indexByName.get(name);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    /**
     * Number of descendants of a node.
     */
    public int descendantCount(int index) {
        int count = 0;
        for (HierarchyNode child : children(index)) {
            count += 1 + descendantCount(child.index());
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return nodes.equals(((HierarchyTree) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(ROOT_INDEX, 0, sb);
        return sb.toString();
    }

    private void render(int index, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(node(index).name()).append('\n');
        for (int child : node(index).childIndices()) {
            render(child, depth + 1, sb);
        }
    }
}
