package com.orgchart.resolution.core.model;

import java.util.Objects;

/**
 * Result of comparing a target name with a candidate string or record.
 * A pure value with no lifecycle beyond the call that produced it.
 *
 * @param score        similarity between 0.0 and 1.0
 * @param confidence   confidence band
 * @param algorithm    algorithm that produced the score
 * @param matchedField label of the field that matched, or null for plain string comparisons
 * @param matchedText  the text that matched
 * @param distance     Levenshtein distance between the compared strings, or null when not computed
 */
public record MatchResult(
        double score,
        MatchConfidence confidence,
        MatchAlgorithm algorithm,
        String matchedField,
        String matchedText,
        Integer distance
) {
    public MatchResult {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        Objects.requireNonNull(confidence, "confidence is required");
        Objects.requireNonNull(algorithm, "algorithm is required");
    }

    /**
     * Creates a result whose confidence is derived from the score.
     */
    public static MatchResult of(double score, MatchAlgorithm algorithm, String matchedText, Integer distance) {
        return new MatchResult(score, MatchConfidence.fromScore(score), algorithm, null, matchedText, distance);
    }

    public boolean isExact() {
        return algorithm == MatchAlgorithm.EXACT;
    }

    /**
     * Score as a rounded percentage.
     */
    public int percentage() {
        return (int) Math.round(score * 100);
    }

    /**
     * Short human-readable form, e.g. {@code HIGH 85% (jaro-winkler)}.
     */
    public String format() {
        String base = confidence + " " + percentage() + "% (" + algorithm.identifier() + ")";
        return matchedField != null ? base + " via " + matchedField : base;
    }
}
