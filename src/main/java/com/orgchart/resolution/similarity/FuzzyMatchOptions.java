package com.orgchart.resolution.similarity;

import java.util.Objects;

/**
 * Options for {@link FuzzyMatcher}.
 */
public final class FuzzyMatchOptions {

    private static final double DEFAULT_THRESHOLD = 0.6;
    private static final int DEFAULT_LIMIT = 10;

    private final double threshold;
    private final boolean usePhonetic;
    private final boolean preferExact;
    private final int limit;

    private FuzzyMatchOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.usePhonetic = builder.usePhonetic;
        this.preferExact = builder.preferExact;
        this.limit = builder.limit;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isUsePhonetic() {
        return usePhonetic;
    }

    public boolean isPreferExact() {
        return preferExact;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Threshold 0.6, phonetic matching on, substring preference on, limit 10.
     */
    public static FuzzyMatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .threshold(threshold)
                .usePhonetic(usePhonetic)
                .preferExact(preferExact)
                .limit(limit);
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private boolean usePhonetic = true;
        private boolean preferExact = true;
        private int limit = DEFAULT_LIMIT;

        public Builder threshold(double threshold) {
            if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder usePhonetic(boolean usePhonetic) {
            this.usePhonetic = usePhonetic;
            return this;
        }

        public Builder preferExact(boolean preferExact) {
            this.preferExact = preferExact;
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            this.limit = limit;
            return this;
        }

        public FuzzyMatchOptions build() {
            return new FuzzyMatchOptions(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FuzzyMatchOptions that = (FuzzyMatchOptions) o;
        return Double.compare(threshold, that.threshold) == 0
                && usePhonetic == that.usePhonetic
                && preferExact == that.preferExact
                && limit == that.limit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(threshold, usePhonetic, preferExact, limit);
    }

    @Override
    public String toString() {
        return "FuzzyMatchOptions{" +
                "threshold=" + threshold +
                ", usePhonetic=" + usePhonetic +
                ", preferExact=" + preferExact +
                ", limit=" + limit +
                '}';
    }
}
