package com.orgchart.resolution.aggregation;

import com.orgchart.resolution.core.model.DistributionBucket;
import com.orgchart.resolution.core.model.DistributionKind;
import com.orgchart.resolution.core.model.MetricKind;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derived values of one tree node. The node's own data (the original snapshot) and the
 * sums over its descendants are kept apart, so "own" and "aggregated" stay distinguishable.
 *
 * @param nodeIndex               index of the node in its tree
 * @param subordinateCount        number of descendants
 * @param ownMetrics              the node's own yearly metrics
 * @param descendantMetrics       yearly metrics summed over all descendants
 * @param ownDistributions        the node's own well-formed histograms
 * @param descendantDistributions histograms summed over all descendants, buckets sorted by range
 */
public record NodeAggregate(
        int nodeIndex,
        int subordinateCount,
        Map<MetricKind, Map<String, Double>> ownMetrics,
        Map<MetricKind, Map<String, Double>> descendantMetrics,
        Map<DistributionKind, Map<String, List<DistributionBucket>>> ownDistributions,
        Map<DistributionKind, Map<String, List<DistributionBucket>>> descendantDistributions
) {
    public NodeAggregate {
        if (subordinateCount < 0) {
            throw new IllegalArgumentException("subordinateCount must be non-negative");
        }
        Objects.requireNonNull(ownMetrics, "ownMetrics is required");
        Objects.requireNonNull(descendantMetrics, "descendantMetrics is required");
        Objects.requireNonNull(ownDistributions, "ownDistributions is required");
        Objects.requireNonNull(descendantDistributions, "descendantDistributions is required");
    }

    public boolean hasDescendants() {
        return subordinateCount > 0;
    }

    public double ownMetric(MetricKind kind, String year) {
        return value(ownMetrics, kind, year);
    }

    /**
     * Sum of the metric over all descendants.
     */
    public double aggregatedMetric(MetricKind kind, String year) {
        return value(descendantMetrics, kind, year);
    }

    /**
     * Own value plus the descendants' sum.
     */
    public double combinedMetric(MetricKind kind, String year) {
        return ownMetric(kind, year) + aggregatedMetric(kind, year);
    }

    /**
     * Own value when non-zero, otherwise the descendants' sum.
     */
    public double effectiveMetric(MetricKind kind, String year) {
        double own = ownMetric(kind, year);
        return own != 0.0 ? own : aggregatedMetric(kind, year);
    }

    /**
     * True when the effective value comes from descendants rather than the node's own data.
     */
    public boolean usesAggregatedMetric(MetricKind kind, String year) {
        return ownMetric(kind, year) == 0.0 && aggregatedMetric(kind, year) != 0.0;
    }

    /**
     * Effective wages divided by effective head count, when head count is positive.
     */
    public OptionalDouble averageWage(String year) {
        double headCount = effectiveMetric(MetricKind.HEADCOUNT, year);
        if (headCount <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(effectiveMetric(MetricKind.WAGES, year) / headCount);
    }

    public List<DistributionBucket> ownDistribution(DistributionKind kind, String year) {
        return buckets(ownDistributions, kind, year);
    }

    /**
     * Histogram summed per identical range over all descendants.
     */
    public List<DistributionBucket> aggregatedDistribution(DistributionKind kind, String year) {
        return buckets(descendantDistributions, kind, year);
    }

    /**
     * Own histogram plus the descendants' histogram.
     */
    public List<DistributionBucket> combinedDistribution(DistributionKind kind, String year) {
        SubtreeTotals totals = new SubtreeTotals();
        ownDistribution(kind, year).forEach(b -> totals.addBucket(kind, year, b));
        aggregatedDistribution(kind, year).forEach(b -> totals.addBucket(kind, year, b));
        return buckets(totals.distributions(), kind, year);
    }

    /**
     * Own histogram when non-empty, otherwise the descendants' histogram.
     */
    public List<DistributionBucket> effectiveDistribution(DistributionKind kind, String year) {
        List<DistributionBucket> own = ownDistribution(kind, year);
        return !own.isEmpty() ? own : aggregatedDistribution(kind, year);
    }

    /**
     * Summary statistics of the effective histogram.
     */
    public Optional<DistributionStatistics> statistics(DistributionKind kind, String year) {
        return DistributionStatistics.of(effectiveDistribution(kind, year));
    }

    /**
     * Years with histogram data for the kind, own or aggregated, ascending.
     */
    public Set<String> distributionYears(DistributionKind kind) {
        Set<String> years = new TreeSet<>(ownDistributions.getOrDefault(kind, Map.of()).keySet());
        years.addAll(descendantDistributions.getOrDefault(kind, Map.of()).keySet());
        return years;
    }

    /**
     * Years with metric data for the kind, own or aggregated, ascending.
     */
    public Set<String> metricYears(MetricKind kind) {
        Set<String> years = new TreeSet<>(ownMetrics.getOrDefault(kind, Map.of()).keySet());
        years.addAll(descendantMetrics.getOrDefault(kind, Map.of()).keySet());
        return years;
    }

    private static double value(Map<MetricKind, Map<String, Double>> metrics, MetricKind kind, String year) {
        Double value = metrics.getOrDefault(kind, Map.of()).get(year);
        return value != null ? value : 0.0;
    }

    private static List<DistributionBucket> buckets(Map<DistributionKind, Map<String, List<DistributionBucket>>> map,
                                                    DistributionKind kind, String year) {
        return map.getOrDefault(kind, Map.of()).getOrDefault(year, List.of());
    }
}
