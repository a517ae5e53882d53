package com.streamfirst.querycache.ports;

import com.streamfirst.querycache.domain.CachedResult;

import java.util.Optional;
import java.util.Set;

/**
 * Port for the physical store holding cached query results.
 * The invalidation engine only calls {@link #invalidateByDependencyTags(Set)}; the remaining
 * operations belong to the command pipeline that reads and populates the cache.
 */
public interface CacheStorePort {

    /**
     * Stores a result under a key, indexed by each of its dependency tags.
     *
     * @param key the cache key of the read command
     * @param result the result and its dependency tags
     */
    void put(String key, CachedResult result);

    /**
     * Looks up a cached result.
     *
     * @param key the cache key of the read command
     * @return the result, or empty if absent or expired
     */
    Optional<CachedResult> get(String key);

    /**
     * Removes every entry tagged with any of the given dependency tags.
     * Implementations are responsible for their own concurrency control.
     *
     * @param cacheDependencies tags to purge
     * @throws RuntimeException if the store is unavailable; callers must not assume the purge happened
     */
    void invalidateByDependencyTags(Set<String> cacheDependencies);

    /**
     * Removes every cached entry regardless of its tags.
     */
    void clearAllCachedEntries();
}
