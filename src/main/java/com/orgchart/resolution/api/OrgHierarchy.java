package com.orgchart.resolution.api;

import com.orgchart.resolution.aggregation.AggregationResult;
import com.orgchart.resolution.aggregation.NodeAggregate;
import com.orgchart.resolution.diagnostics.Diagnostic;
import com.orgchart.resolution.diagnostics.Severity;
import com.orgchart.resolution.hierarchy.HierarchyNode;
import com.orgchart.resolution.hierarchy.HierarchyTree;
import com.orgchart.resolution.hierarchy.UnattachedRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A built organization: the tree, its aggregates, the records left out and every
 * data-quality event of the build.
 *
 * @param buildId     identifier of the build, also found in the build's log lines
 * @param tree        the tree
 * @param aggregation derived values per node
 * @param unattached  records left out of the tree
 * @param diagnostics data-quality events
 */
public record OrgHierarchy(
        String buildId,
        HierarchyTree tree,
        AggregationResult aggregation,
        List<UnattachedRecord> unattached,
        List<Diagnostic> diagnostics
) {
    public OrgHierarchy {
        Objects.requireNonNull(tree, "tree is required");
        Objects.requireNonNull(aggregation, "aggregation is required");
        unattached = unattached == null ? List.of() : List.copyOf(unattached);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public HierarchyNode root() {
        return tree.root();
    }

    public Optional<HierarchyNode> find(String name) {
        return tree.find(name);
    }

    public NodeAggregate aggregate(HierarchyNode node) {
        return aggregation.get(node);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }
}
