package com.orgchart.resolution.similarity;

/**
 * Jaro-Winkler similarity algorithm.
 * Gives higher scores to strings that match from the beginning; the prefix bonus
 * applies only once the Jaro score reaches the boost threshold.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_SCALING_FACTOR = 0.1;
    private static final double DEFAULT_BOOST_THRESHOLD = 0.7;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final JaroSimilarity jaro = new JaroSimilarity();
    private final double scalingFactor;
    private final double boostThreshold;

    public JaroWinklerSimilarity() {
        this(DEFAULT_SCALING_FACTOR, DEFAULT_BOOST_THRESHOLD);
    }

    public JaroWinklerSimilarity(double scalingFactor, double boostThreshold) {
        if (scalingFactor < 0 || scalingFactor > 0.25) {
            throw new IllegalArgumentException("Scaling factor must be between 0 and 0.25");
        }
        if (boostThreshold < 0 || boostThreshold > 1) {
            throw new IllegalArgumentException("Boost threshold must be between 0 and 1");
        }
        this.scalingFactor = scalingFactor;
        this.boostThreshold = boostThreshold;
    }

    @Override
    public double compute(String s1, String s2) {
        double jaroSimilarity = jaro.compute(s1, s2);
        if (jaroSimilarity < boostThreshold || jaroSimilarity == 1.0) {
            return jaroSimilarity;
        }

        int prefixLength = 0;
        int maxPrefixLength = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        while (prefixLength < maxPrefixLength && s1.charAt(prefixLength) == s2.charAt(prefixLength)) {
            prefixLength++;
        }

        // jw = jaro + (prefix * scalingFactor * (1 - jaro))
        return jaroSimilarity + (prefixLength * scalingFactor * (1.0 - jaroSimilarity));
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }
}
