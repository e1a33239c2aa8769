package com.orgchart.resolution.core.model;

/**
 * Confidence band of a match score.
 */
public enum MatchConfidence {
    HIGH,
    MEDIUM,
    LOW;

    private static final double HIGH_THRESHOLD = 0.9;
    private static final double MEDIUM_THRESHOLD = 0.7;

    /**
     * Maps a score to its band: {@code >= 0.9} high, {@code >= 0.7} medium, otherwise low.
     */
    public static MatchConfidence fromScore(double score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
