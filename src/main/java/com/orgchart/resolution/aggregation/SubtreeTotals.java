package com.orgchart.resolution.aggregation;

import com.orgchart.resolution.core.model.BucketRange;
import com.orgchart.resolution.core.model.DistributionBucket;
import com.orgchart.resolution.core.model.DistributionKind;
import com.orgchart.resolution.core.model.MetricKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running sums of yearly metrics and of histogram counts keyed by identical bucket range.
 */
final class SubtreeTotals {

    private final Map<MetricKind, TreeMap<String, Double>> metrics = new EnumMap<>(MetricKind.class);
    private final Map<DistributionKind, TreeMap<String, TreeMap<BucketRange, Long>>> distributions =
            new EnumMap<>(DistributionKind.class);

    void addMetric(MetricKind kind, String year, double value) {
        metrics.computeIfAbsent(kind, k -> new TreeMap<>()).merge(year, value, Double::sum);
    }

    void addBucket(DistributionKind kind, String year, DistributionBucket bucket) {
        distributions.computeIfAbsent(kind, k -> new TreeMap<>())
                .computeIfAbsent(year, y -> new TreeMap<>())
                .merge(bucket.range(), bucket.count(), Long::sum);
    }

    void addMetrics(Map<MetricKind, Map<String, Double>> values) {
        values.forEach((kind, years) -> years.forEach((year, value) -> addMetric(kind, year, value)));
    }

    void addDistributions(Map<DistributionKind, Map<String, List<DistributionBucket>>> values) {
        values.forEach((kind, years) -> years.forEach((year, buckets) ->
                buckets.forEach(bucket -> addBucket(kind, year, bucket))));
    }

    void addAll(SubtreeTotals other) {
        other.metrics.forEach((kind, years) -> years.forEach((year, value) -> addMetric(kind, year, value)));
        other.distributions.forEach((kind, years) -> years.forEach((year, ranges) ->
                ranges.forEach((range, count) -> addBucket(kind, year, new DistributionBucket(range, count)))));
    }

    Map<MetricKind, Map<String, Double>> metrics() {
        if (metrics.isEmpty()) {
            return Map.of();
        }
        EnumMap<MetricKind, Map<String, Double>> copy = new EnumMap<>(MetricKind.class);
        metrics.forEach((kind, years) -> copy.put(kind, Collections.unmodifiableSortedMap(new TreeMap<>(years))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Sums as bucket lists sorted by (low, high).
     */
    Map<DistributionKind, Map<String, List<DistributionBucket>>> distributions() {
        if (distributions.isEmpty()) {
            return Map.of();
        }
        EnumMap<DistributionKind, Map<String, List<DistributionBucket>>> copy = new EnumMap<>(DistributionKind.class);
        distributions.forEach((kind, years) -> {
            TreeMap<String, List<DistributionBucket>> byYear = new TreeMap<>();
            years.forEach((year, ranges) -> {
                List<DistributionBucket> buckets = new ArrayList<>(ranges.size());
                ranges.forEach((range, count) -> buckets.add(new DistributionBucket(range, count)));
                byYear.put(year, List.copyOf(buckets));
            });
            copy.put(kind, Collections.unmodifiableSortedMap(byYear));
        });
        return Collections.unmodifiableMap(copy);
    }
}
