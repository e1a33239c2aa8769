package com.orgchart.resolution.matching;

import com.orgchart.resolution.similarity.FuzzyMatchOptions;

import java.util.Objects;

/**
 * Options for cross-dataset match resolution.
 * Configures the exact-name score, the cap on weighted fuzzy evidence and the
 * acceptance threshold.
 */
public class ResolutionOptions {

    private static final double DEFAULT_EXACT_NAME_SCORE = 0.8;
    private static final double DEFAULT_FUZZY_CAP = 0.7;
    private static final double DEFAULT_MINIMUM_SCORE = 0.3;
    private static final double DEFAULT_FUZZY_THRESHOLD = 0.3;

    private final double exactNameScore;
    private final double fuzzyCap;
    private final double minimumScore;
    private final double fuzzyThreshold;
    private final boolean usePhonetic;
    private final boolean preferExact;

    private ResolutionOptions(Builder builder) {
        this.exactNameScore = builder.exactNameScore;
        this.fuzzyCap = builder.fuzzyCap;
        this.minimumScore = builder.minimumScore;
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.usePhonetic = builder.usePhonetic;
        this.preferExact = builder.preferExact;
    }

    /**
     * Score given to a field that equals the target's name or one of its aliases.
     */
    public double getExactNameScore() {
        return exactNameScore;
    }

    /**
     * Upper bound of weighted fuzzy evidence; always below {@link #getExactNameScore()}.
     */
    public double getFuzzyCap() {
        return fuzzyCap;
    }

    public double getMinimumScore() {
        return minimumScore;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public boolean isUsePhonetic() {
        return usePhonetic;
    }

    public boolean isPreferExact() {
        return preferExact;
    }

    /**
     * Options handed to the fuzzy matcher for each candidate field.
     */
    public FuzzyMatchOptions toFuzzyMatchOptions() {
        return FuzzyMatchOptions.builder()
                .threshold(fuzzyThreshold)
                .usePhonetic(usePhonetic)
                .preferExact(preferExact)
                .build();
    }

    /**
     * Creates default options.
     */
    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options (higher acceptance threshold, no phonetic matching).
     */
    public static ResolutionOptions strict() {
        return builder()
                .minimumScore(0.5)
                .fuzzyCap(0.6)
                .usePhonetic(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double exactNameScore = DEFAULT_EXACT_NAME_SCORE;
        private double fuzzyCap = DEFAULT_FUZZY_CAP;
        private double minimumScore = DEFAULT_MINIMUM_SCORE;
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private boolean usePhonetic = true;
        private boolean preferExact = true;

        public Builder exactNameScore(double exactNameScore) {
            validateThreshold(exactNameScore, "exactNameScore");
            this.exactNameScore = exactNameScore;
            return this;
        }

        public Builder fuzzyCap(double fuzzyCap) {
            validateThreshold(fuzzyCap, "fuzzyCap");
            this.fuzzyCap = fuzzyCap;
            return this;
        }

        public Builder minimumScore(double minimumScore) {
            validateThreshold(minimumScore, "minimumScore");
            this.minimumScore = minimumScore;
            return this;
        }

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            validateThreshold(fuzzyThreshold, "fuzzyThreshold");
            this.fuzzyThreshold = fuzzyThreshold;
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

        public ResolutionOptions build() {
            if (fuzzyCap >= exactNameScore) {
                throw new IllegalArgumentException("fuzzyCap must be < exactNameScore");
            }
            if (minimumScore > exactNameScore) {
                throw new IllegalArgumentException("minimumScore must be <= exactNameScore");
            }
            return new ResolutionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolutionOptions that = (ResolutionOptions) o;
        return Double.compare(that.exactNameScore, exactNameScore) == 0
                && Double.compare(that.fuzzyCap, fuzzyCap) == 0
                && Double.compare(that.minimumScore, minimumScore) == 0
                && Double.compare(that.fuzzyThreshold, fuzzyThreshold) == 0
                && usePhonetic == that.usePhonetic
                && preferExact == that.preferExact;
    }

    @Override
    public int hashCode() {
        return Objects.hash(exactNameScore, fuzzyCap, minimumScore, fuzzyThreshold, usePhonetic, preferExact);
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "exactNameScore=" + exactNameScore +
                ", fuzzyCap=" + fuzzyCap +
                ", minimumScore=" + minimumScore +
                ", fuzzyThreshold=" + fuzzyThreshold +
                ", usePhonetic=" + usePhonetic +
                ", preferExact=" + preferExact +
                '}';
    }
}
