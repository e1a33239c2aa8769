package com.orgchart.resolution.cache;

import java.util.Optional;

/**
 * Cache for cross-dataset resolution outcomes, keyed by target, record and options.
 * Entries are valid only for the lookup context that produced them.
 */
public interface MatchCache {

    /**
     * Gets a cached outcome.
     *
     * @param key the resolution key
     * @return the cached outcome, or empty if not cached
     */
    Optional<CachedMatch> get(MatchCacheKey key);

    /**
     * Caches an outcome.
     *
     * @param key   the resolution key
     * @param match the outcome, possibly "no match"
     */
    void put(MatchCacheKey key, CachedMatch match);

    /**
     * Invalidates all entries for the given target name.
     *
     * @param targetName the target entity's name
     */
    void invalidate(String targetName);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
