package com.streamfirst.querycache.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.Collection;
import java.util.SortedSet;

/**
 * A query result as handed to a cache store, tagged with the dependencies it was resolved to.
 * The engine never stores these; it only computes the tags.
 */
@Value
public class CachedResult {

    /** The materialized query result */
    Object value;

    /** Tags that invalidate this result */
    SortedSet<String> cacheDependencies;

    /** The policy the result was cached under */
    CachePolicy policy;

    public CachedResult(Object value, @NonNull Collection<String> cacheDependencies, @NonNull CachePolicy policy) {
        if (cacheDependencies.isEmpty()) {
            throw new IllegalArgumentException("Cached result must carry at least one dependency tag");
        }
        this.value = value;
        this.cacheDependencies = CacheDependencies.immutable(cacheDependencies);
        this.policy = policy;
    }

    @Override
    public String toString() {
        return "CachedResult{" +
               "cacheDependencies=" + cacheDependencies +
               ", expirationMode=" + policy.getExpirationMode() +
               ", timeout=" + policy.getTimeout() +
               '}';
    }
}
