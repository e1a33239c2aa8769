package com.orgchart.resolution.matching;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link EntityNameMatcher#findMatches}: every plausible candidate, best first,
 * and the best one when it is confident enough to pick without review.
 *
 * @param bestMatch        the confident best match, or null
 * @param potentialMatches candidates with a positive score, best first
 */
public record EntityMatchReport(ScoredEntity bestMatch, List<ScoredEntity> potentialMatches) {

    public EntityMatchReport {
        potentialMatches = potentialMatches == null ? List.of() : List.copyOf(potentialMatches);
    }

    public Optional<ScoredEntity> best() {
        return Optional.ofNullable(bestMatch);
    }

    public static EntityMatchReport empty() {
        return new EntityMatchReport(null, List.of());
    }
}
