package com.streamfirst.querycache.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.SortedSet;

/**
 * Per-query caching options supplied by the caller. Explicit dependencies are only consulted when
 * no known table could be found in the command text.
 */
@Value
public class CachePolicy {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

    /** How long a cached result stays valid */
    Duration timeout;

    /** Whether {@link #timeout} counts from storage or from the last read */
    CacheExpirationMode expirationMode;

    /** Tags declared by the caller, used when the command text yields no known table */
    SortedSet<String> cacheDependencies;

    /** Whether dependency resolution for this query is logged */
    boolean loggingEnabled;

    @Builder
    private CachePolicy(Duration timeout,
                        CacheExpirationMode expirationMode,
                        Collection<String> cacheDependencies,
                        Boolean loggingEnabled) {
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.expirationMode = expirationMode != null ? expirationMode : CacheExpirationMode.ABSOLUTE;
        this.cacheDependencies = CacheDependencies.immutable(cacheDependencies);
        this.loggingEnabled = loggingEnabled == null || loggingEnabled;

        if (this.timeout.isNegative() || this.timeout.isZero()) {
            throw new IllegalArgumentException("Cache timeout must be positive: " + this.timeout);
        }
    }

    /**
     * Absolute expiration after {@link #DEFAULT_TIMEOUT}, no explicit dependencies, logging on.
     */
    public static CachePolicy defaultPolicy() {
        return builder().build();
    }

    /**
     * Shortcut for a default policy declaring the given dependencies.
     */
    public static CachePolicy withDependencies(String... cacheDependencies) {
        return builder().cacheDependencies(cacheDependencies).build();
    }

    public boolean hasCacheDependencies() {
        return !cacheDependencies.isEmpty();
    }

    public static class CachePolicyBuilder {

        public CachePolicyBuilder cacheDependencies(Collection<String> cacheDependencies) {
            this.cacheDependencies = cacheDependencies;
            return this;
        }

        public CachePolicyBuilder cacheDependencies(String... cacheDependencies) {
            this.cacheDependencies = cacheDependencies == null ? null : Arrays.asList(cacheDependencies);
            return this;
        }
    }
}
