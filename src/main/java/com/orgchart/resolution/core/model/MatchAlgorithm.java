package com.orgchart.resolution.core.model;

/**
 * Algorithm that produced a match score.
 */
public enum MatchAlgorithm {
    EXACT("exact"),
    SUBSTRING("substring"),
    JARO_WINKLER("jaro-winkler"),
    LEVENSHTEIN("levenshtein"),
    SOUNDEX("soundex"),
    FIELD_WEIGHTED("field-weighted");

    private final String identifier;

    MatchAlgorithm(String identifier) {
        this.identifier = identifier;
    }

    /**
     * Stable identifier used when results are reported to callers.
     */
    public String identifier() {
        return identifier;
    }

    @Override
    public String toString() {
        return identifier;
    }
}
