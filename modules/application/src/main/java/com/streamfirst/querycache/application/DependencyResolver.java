package com.streamfirst.querycache.application;

import com.streamfirst.querycache.domain.CacheDependencies;
import com.streamfirst.querycache.domain.CacheInvalidationSettings;
import com.streamfirst.querycache.domain.CachePolicy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Maps a command to the dependency tags its cached result is filed under.
 * Resolution cascades from known tables named in the command text, to the policy's explicit
 * dependencies, to the {@link CacheDependencies#UNKNOWN_DEPENDENCY} sentinel, so the result is
 * never empty.
 */
@Slf4j
@RequiredArgsConstructor
public class DependencyResolver {

    private final TableNameExtractor tableNameExtractor;
    private final CacheInvalidationSettings settings;

    /**
     * Finds the related table names of a command.
     *
     * @param policy caching options of the query, supplies explicit dependencies
     * @param knownResourceNames every table name of the schema owner
     * @param commandText raw command text, may be null
     * @return a new, mutable and non-empty set of dependency tags
     */
    public SortedSet<String> resolveDependencies(@NonNull CachePolicy policy,
                                                 @NonNull Set<String> knownResourceNames,
                                                 String commandText) {
        SortedSet<String> candidates = tableNameExtractor.extractCandidateIdentifiers(commandText);

        SortedSet<String> cacheDependencies = new TreeSet<>(candidates);
        cacheDependencies.retainAll(knownResourceNames);
        if (!cacheDependencies.isEmpty()) {
            logResolution(policy, knownResourceNames, candidates, cacheDependencies);
            return cacheDependencies;
        }

        if (policy.hasCacheDependencies()) {
            cacheDependencies = new TreeSet<>(policy.getCacheDependencies());
        } else {
            if (isLoggingEnabled(policy)) {
                log.debug("It's not possible to calculate the related table names of the current query [{}]. "
                          + "Declare them explicitly with CachePolicy.builder().cacheDependencies(...)",
                          commandText);
            }
            cacheDependencies = CacheDependencies.unknown();
        }

        logResolution(policy, knownResourceNames, candidates, cacheDependencies);
        return cacheDependencies;
    }

    /**
     * Whether diagnostics for the given policy should be written.
     */
    boolean isLoggingEnabled(CachePolicy policy) {
        return !settings.disableLogging() && policy.isLoggingEnabled() && log.isDebugEnabled();
    }

    private void logResolution(CachePolicy policy,
                               Set<String> knownResourceNames,
                               Set<String> candidates,
                               Set<String> cacheDependencies) {
        if (isLoggingEnabled(policy)) {
            log.debug("ContextTableNames: {}, PossibleQueryTableNames: {} -> CacheDependencies: {}.",
                      CacheDependencies.format(knownResourceNames),
                      CacheDependencies.format(candidates),
                      CacheDependencies.format(cacheDependencies));
        }
    }
}
