package com.streamfirst.querycache.domain;

/**
 * How the timeout of a {@link CachePolicy} is measured.
 */
public enum CacheExpirationMode {
    /** Entry expires a fixed duration after it was stored */
    ABSOLUTE,
    /** Entry expires once it has not been read for the duration */
    SLIDING
}
