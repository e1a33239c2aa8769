package com.orgchart.resolution.core.model;

import java.util.Objects;

/**
 * One histogram bucket: a range and the number of people falling in it.
 *
 * @param range the bucket range
 * @param count number of people in the range
 */
public record DistributionBucket(BucketRange range, long count) {

    public DistributionBucket {
        Objects.requireNonNull(range, "range is required");
    }

    public static DistributionBucket of(double low, double high, long count) {
        return new DistributionBucket(new BucketRange(low, high), count);
    }

    /**
     * A bucket is well formed when its range is valid and its count is non-negative.
     */
    public boolean isWellFormed() {
        return range.isValid() && count >= 0;
    }
}
