package com.orgchart.resolution.cache;

import com.orgchart.resolution.core.model.MatchResult;

import java.util.Optional;

/**
 * A cached resolution outcome. A null result records that nothing matched,
 * so repeated misses are served from the cache too.
 *
 * @param result the match, or null for "no match"
 */
public record CachedMatch(MatchResult result) {

    public static CachedMatch of(Optional<MatchResult> result) {
        return new CachedMatch(result.orElse(null));
    }

    public Optional<MatchResult> asOptional() {
        return Optional.ofNullable(result);
    }
}
