package com.orgchart.resolution.matching;

import com.orgchart.resolution.core.model.EntityRecord;

import java.util.Objects;

/**
 * An entity record scored against a free-text name.
 *
 * @param record    the candidate entity
 * @param score     score between 0.0 and 1.0
 * @param matchType how the score was obtained
 */
public record ScoredEntity(EntityRecord record, double score, EntityMatchType matchType) {

    public ScoredEntity {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(matchType, "matchType is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
    }

    public boolean isPartialMatch() {
        return matchType == EntityMatchType.PARTIAL;
    }
}
