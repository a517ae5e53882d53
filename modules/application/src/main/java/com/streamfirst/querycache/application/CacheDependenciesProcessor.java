package com.streamfirst.querycache.application;

import com.streamfirst.querycache.domain.CachePolicy;
import com.streamfirst.querycache.domain.SchemaOwnerId;
import com.streamfirst.querycache.ports.CacheStorePort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.SortedSet;

/**
 * Entry point for the command pipeline.
 * Reads call {@link #resolveReadDependencies} and tag their cached result with the answer;
 * every executed command is then passed to {@link #invalidateIfMutating}.
 */
@Slf4j
@RequiredArgsConstructor
public class CacheDependenciesProcessor {

    private final ResourceCatalog resourceCatalog;
    private final CommandClassifier commandClassifier;
    private final DependencyResolver dependencyResolver;
    private final InvalidationCoordinator invalidationCoordinator;
    private final CacheStorePort cacheStore;

    /**
     * Finds the related table names of a read command.
     *
     * @param policy caching options of the query
     * @param schemaOwner the data model the query runs against
     * @param commandText raw command text
     * @return non-empty set of dependency tags for the cached result
     */
    public SortedSet<String> resolveReadDependencies(@NonNull CachePolicy policy,
                                                     @NonNull SchemaOwnerId schemaOwner,
                                                     String commandText) {
        SortedSet<String> knownResourceNames = resourceCatalog.resolveResourceNames(schemaOwner);
        return dependencyResolver.resolveDependencies(policy, knownResourceNames, commandText);
    }

    /**
     * Finds the related table names of a command against an explicit set of known tables.
     */
    public SortedSet<String> resolveDependencies(@NonNull CachePolicy policy,
                                                 @NonNull Set<String> knownResourceNames,
                                                 String commandText) {
        return dependencyResolver.resolveDependencies(policy, knownResourceNames, commandText);
    }

    /**
     * Invalidates the configured store's entries affected by a command, if it is mutating.
     *
     * @return true if invalidation occurred
     */
    public boolean invalidateIfMutating(String commandText,
                                        @NonNull SchemaOwnerId schemaOwner,
                                        @NonNull CachePolicy policy) {
        return invalidateIfMutating(commandText, schemaOwner, policy, cacheStore);
    }

    /**
     * Invalidates the given store's entries affected by a command, if it is mutating.
     *
     * @return true if invalidation occurred
     */
    public boolean invalidateIfMutating(String commandText,
                                        @NonNull SchemaOwnerId schemaOwner,
                                        @NonNull CachePolicy policy,
                                        @NonNull CacheStorePort store) {
        boolean invalidated = invalidationCoordinator.invalidateIfMutating(commandText, schemaOwner, policy, store);
        log.trace("Command for schema owner {} mutating: {}", schemaOwner, invalidated);
        return invalidated;
    }

    /**
     * Is the command an {@code insert}, {@code update}, {@code delete} or {@code create}?
     */
    public boolean isMutatingCommand(String commandText) {
        return commandClassifier.isMutatingCommand(commandText);
    }
}
