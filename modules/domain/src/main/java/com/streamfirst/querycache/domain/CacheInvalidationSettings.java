package com.streamfirst.querycache.domain;

/**
 * Process-wide switches for the invalidation engine.
 *
 * @param disableLogging suppresses all dependency resolution and invalidation debug output
 */
public record CacheInvalidationSettings(boolean disableLogging) {

    public static CacheInvalidationSettings defaults() {
        return new CacheInvalidationSettings(false);
    }
}
