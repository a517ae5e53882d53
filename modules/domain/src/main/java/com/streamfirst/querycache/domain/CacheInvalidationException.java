package com.streamfirst.querycache.domain;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The cache store rejected a purge request. Entries tagged with {@link #getCacheDependencies()}
 * may still be served, so callers must not treat the write as fully handled.
 */
public class CacheInvalidationException extends RuntimeException {

    private final SortedSet<String> cacheDependencies;

    public CacheInvalidationException(SortedSet<String> cacheDependencies, Throwable cause) {
        super("Failed to invalidate cache dependencies [" + CacheDependencies.format(cacheDependencies) + "]", cause);
        this.cacheDependencies = Collections.unmodifiableSortedSet(new TreeSet<>(cacheDependencies));
    }

    public SortedSet<String> getCacheDependencies() {
        return cacheDependencies;
    }
}
