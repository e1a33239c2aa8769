package com.orgchart.resolution.aggregation;

import com.orgchart.resolution.core.model.DistributionBucket;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Summary statistics of a histogram, treating every person in a bucket as sitting at the
 * bucket's midpoint.
 *
 * @param totalCount   number of people
 * @param mean         midpoint-weighted mean
 * @param median       middle value
 * @param percentile68 68th percentile
 * @param percentile84 84th percentile
 * @param percentile95 95th percentile
 * @param trimmedMean  mean of the midpoints inside the trim range, empty when none is
 */
public record DistributionStatistics(
        long totalCount,
        double mean,
        double median,
        double percentile68,
        double percentile84,
        double percentile95,
        OptionalDouble trimmedMean
) {
    public static final double DEFAULT_TRIM_LOW = 20_000;
    public static final double DEFAULT_TRIM_HIGH = 500_000;

    /**
     * Statistics with the default salary trim range of 20,000 to 500,000.
     */
    public static Optional<DistributionStatistics> of(List<DistributionBucket> buckets) {
        return of(buckets, DEFAULT_TRIM_LOW, DEFAULT_TRIM_HIGH);
    }

    /**
     * Computes the statistics; empty when there is no well-formed bucket with a positive count.
     *
     * @param buckets  the histogram
     * @param trimLow  lowest midpoint kept by the trimmed mean
     * @param trimHigh highest midpoint kept by the trimmed mean
     */
    public static Optional<DistributionStatistics> of(List<DistributionBucket> buckets,
                                                      double trimLow, double trimHigh) {
        if (trimLow > trimHigh) {
            throw new IllegalArgumentException("trimLow must be <= trimHigh");
        }
        if (buckets == null) {
            return Optional.empty();
        }

        List<DistributionBucket> sorted = new ArrayList<>();
        for (DistributionBucket bucket : buckets) {
            if (bucket.isWellFormed() && bucket.count() > 0) {
                sorted.add(bucket);
            }
        }
        if (sorted.isEmpty()) {
            return Optional.empty();
        }
        sorted.sort(Comparator.comparingDouble(b -> b.range().midpoint()));

        long total = 0;
        double weightedSum = 0;
        long trimmedCount = 0;
        double trimmedSum = 0;
        for (DistributionBucket bucket : sorted) {
            double midpoint = bucket.range().midpoint();
            total += bucket.count();
            weightedSum += midpoint * bucket.count();
            if (midpoint >= trimLow && midpoint <= trimHigh) {
                trimmedCount += bucket.count();
                trimmedSum += midpoint * bucket.count();
            }
        }

        return Optional.of(new DistributionStatistics(
                total,
                weightedSum / total,
                percentile(sorted, total, 50),
                percentile(sorted, total, 68),
                percentile(sorted, total, 84),
                percentile(sorted, total, 95),
                trimmedCount > 0 ? OptionalDouble.of(trimmedSum / trimmedCount) : OptionalDouble.empty()));
    }

    /**
     * Linear interpolation between the closest ranks of the expanded midpoint sequence.
     */
    static double percentile(List<DistributionBucket> sorted, long total, double percentile) {
        double rank = (percentile / 100.0) * (total - 1);
        long lower = (long) Math.floor(rank);
        long upper = (long) Math.ceil(rank);
        double weight = rank - lower;
        return valueAt(sorted, lower) * (1 - weight) + valueAt(sorted, upper) * weight;
    }

    private static double valueAt(List<DistributionBucket> sorted, long position) {
        long cumulative = 0;
        for (DistributionBucket bucket : sorted) {
            cumulative += bucket.count();
            if (position < cumulative) {
                return bucket.range().midpoint();
            }
        }
        return sorted.get(sorted.size() - 1).range().midpoint();
    }
}
