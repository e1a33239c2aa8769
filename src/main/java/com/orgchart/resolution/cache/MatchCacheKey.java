package com.orgchart.resolution.cache;

import com.orgchart.resolution.core.model.ForeignRecord;
import com.orgchart.resolution.matching.ResolutionOptions;

import java.util.Objects;

/**
 * Cache key for one resolution call.
 *
 * @param targetName the target entity's name
 * @param record     the foreign record
 * @param options    the options used
 */
public record MatchCacheKey(String targetName, ForeignRecord record, ResolutionOptions options) {

    public MatchCacheKey {
        Objects.requireNonNull(targetName, "targetName is required");
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(options, "options is required");
    }
}
