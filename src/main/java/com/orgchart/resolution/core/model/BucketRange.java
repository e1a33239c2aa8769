package com.orgchart.resolution.core.model;

import java.util.Comparator;

/**
 * Closed numeric range of a histogram bucket. Aggregation keys buckets by identical ranges.
 *
 * @param low  lower bound
 * @param high upper bound
 */
public record BucketRange(double low, double high) implements Comparable<BucketRange> {

    private static final Comparator<BucketRange> ORDER =
            Comparator.comparingDouble(BucketRange::low).thenComparingDouble(BucketRange::high);

    /**
     * Returns true when both bounds are finite and {@code low <= high}.
     */
    public boolean isValid() {
        return Double.isFinite(low) && Double.isFinite(high) && low <= high;
    }

    /**
     * Midpoint of the range, used for weighted averages.
     */
    public double midpoint() {
        return (low + high) / 2.0;
    }

    @Override
    public int compareTo(BucketRange other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + low + ", " + high + "]";
    }
}
