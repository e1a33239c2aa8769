package com.orgchart.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed match cache with a target-name index for targeted invalidation.
 */
public class CaffeineMatchCache implements MatchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMatchCache.class);

    private final Cache<MatchCacheKey, CachedMatch> cache;
    // target name -> keys resolved against that target
    private final ConcurrentMap<String, Set<MatchCacheKey>> targetIndex = new ConcurrentHashMap<>();

    public CaffeineMatchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((key, value, cause) -> {
                    if (cause.wasEvicted() && key instanceof MatchCacheKey matchKey) {
                        removeFromIndex(matchKey);
                    }
                })
                .build();
        log.info("CaffeineMatchCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<CachedMatch> get(MatchCacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(MatchCacheKey key, CachedMatch match) {
        cache.put(key, match);
        targetIndex.computeIfAbsent(key.targetName(), k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidate(String targetName) {
        Set<MatchCacheKey> keys = targetIndex.remove(targetName);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cache entries for target '{}'", keys.size(), targetName);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        targetIndex.clear();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    private void removeFromIndex(MatchCacheKey key) {
        Set<MatchCacheKey> keys = targetIndex.get(key.targetName());
        if (keys != null) {
            keys.remove(key);
        }
    }
}
