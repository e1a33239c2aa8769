package com.orgchart.resolution.aggregation;

import com.orgchart.resolution.core.model.DistributionBucket;
import com.orgchart.resolution.core.model.DistributionKind;
import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.diagnostics.DiagnosticType;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import com.orgchart.resolution.hierarchy.HierarchyNode;
import com.orgchart.resolution.hierarchy.HierarchyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes subtree sums of yearly metrics and histograms for every node of a tree.
 *
 * <p>Nodes are visited in reverse pre-order, which puts every child before its parent.
 * The tree is not modified; results go into a separate {@link AggregationResult}.</p>
 */
public class DistributionAggregator {
    private static final Logger log = LoggerFactory.getLogger(DistributionAggregator.class);

    public AggregationResult aggregate(HierarchyTree tree) {
        return aggregate(tree, new DiagnosticsCollector());
    }

    /**
     * Aggregates the tree. Buckets that are not well formed are skipped and reported.
     */
    public AggregationResult aggregate(HierarchyTree tree, DiagnosticsCollector diagnostics) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(diagnostics, "diagnostics");

        int size = tree.size();
        NodeAggregate[] aggregates = new NodeAggregate[size];
        SubtreeTotals[] subtrees = new SubtreeTotals[size];

        for (int index = size - 1; index >= 0; index--) {
            HierarchyNode node = tree.node(index);
            Map<DistributionKind, Map<String, List<DistributionBucket>>> ownDistributions =
                    wellFormed(node.record(), diagnostics);

            SubtreeTotals descendants = new SubtreeTotals();
            int subordinateCount = 0;
            for (int child : node.childIndices()) {
                subordinateCount += aggregates[child].subordinateCount() + 1;
                descendants.addAll(subtrees[child]);
                subtrees[child] = null;
            }

            aggregates[index] = new NodeAggregate(index, subordinateCount,
                    node.record().metricsByYear(), descendants.metrics(),
                    ownDistributions, descendants.distributions());

            SubtreeTotals subtree = descendants;
            subtree.addMetrics(node.record().metricsByYear());
            subtree.addDistributions(ownDistributions);
            subtrees[index] = subtree;
        }

        log.info("aggregation.completed nodes={} subordinates={}", size, aggregates[0].subordinateCount());
        return new AggregationResult(Arrays.asList(aggregates));
    }

    private static Map<DistributionKind, Map<String, List<DistributionBucket>>> wellFormed(
            EntityRecord record, DiagnosticsCollector diagnostics) {
        if (record.distributionsByYear().isEmpty()) {
            return Map.of();
        }
        EnumMap<DistributionKind, Map<String, List<DistributionBucket>>> result = new EnumMap<>(DistributionKind.class);
        record.distributionsByYear().forEach((kind, years) -> {
            TreeMap<String, List<DistributionBucket>> byYear = new TreeMap<>();
            years.forEach((year, buckets) -> {
                List<DistributionBucket> kept = new ArrayList<>(buckets.size());
                for (DistributionBucket bucket : buckets) {
                    if (bucket.isWellFormed()) {
                        kept.add(bucket);
                    } else {
                        diagnostics.report(DiagnosticType.MALFORMED_DISTRIBUTION, record.name(),
                                "kind=" + kind + " year=" + year + " range=" + bucket.range()
                                        + " count=" + bucket.count() + " skipped");
                    }
                }
                if (!kept.isEmpty()) {
                    byYear.put(year, List.copyOf(kept));
                }
            });
            if (!byYear.isEmpty()) {
                result.put(kind, Collections.unmodifiableSortedMap(byYear));
            }
        });
        return Collections.unmodifiableMap(result);
    }
}
