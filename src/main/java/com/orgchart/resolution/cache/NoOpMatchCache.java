package com.orgchart.resolution.cache;

import java.util.Optional;

/**
 * No-op cache implementation. Used as the default when caching is disabled.
 */
public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<CachedMatch> get(MatchCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(MatchCacheKey key, CachedMatch match) {
        // no-op
    }

    @Override
    public void invalidate(String targetName) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
