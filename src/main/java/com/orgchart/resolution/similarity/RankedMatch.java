package com.orgchart.resolution.similarity;

import com.orgchart.resolution.core.model.MatchResult;

/**
 * A candidate ranked by {@link FuzzyMatcher#findBestMatch}.
 *
 * @param candidate the candidate string
 * @param index     position of the candidate in the input list
 * @param result    the match result
 */
public record RankedMatch(String candidate, int index, MatchResult result) {

    public double score() {
        return result.score();
    }
}
