package com.streamfirst.querycache.application;

import com.streamfirst.querycache.domain.CacheDependencies;
import com.streamfirst.querycache.domain.CacheInvalidationException;
import com.streamfirst.querycache.domain.CacheInvalidationSettings;
import com.streamfirst.querycache.domain.CachePolicy;
import com.streamfirst.querycache.domain.SchemaOwnerId;
import com.streamfirst.querycache.ports.CacheStorePort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.SortedSet;

/**
 * Purges cached results made stale by a write.
 * Must be called after the write has taken effect and before later reads may repopulate the cache;
 * races between the two are left to the store's own atomicity.
 */
@Slf4j
@RequiredArgsConstructor
public class InvalidationCoordinator {

    private final CommandClassifier commandClassifier;
    private final ResourceCatalog resourceCatalog;
    private final DependencyResolver dependencyResolver;
    private final CacheInvalidationSettings settings;

    /**
     * Invalidates all cache entries depending on the tables a mutating command touches.
     * The sentinel tag is always purged as well, so results that could not be tied to a table
     * never survive a write. Non-mutating commands are ignored.
     *
     * @param commandText the executed command
     * @param schemaOwner the data model the command ran against
     * @param policy caching options of the command
     * @param store the store to purge
     * @return true if the command was mutating and the purge was issued
     * @throws CacheInvalidationException if the store fails to purge
     * @throws com.streamfirst.querycache.domain.SchemaEnumerationException if the schema cannot be enumerated
     */
    public boolean invalidateIfMutating(String commandText,
                                        @NonNull SchemaOwnerId schemaOwner,
                                        @NonNull CachePolicy policy,
                                        @NonNull CacheStorePort store) {
        if (!commandClassifier.isMutatingCommand(commandText)) {
            return false;
        }

        SortedSet<String> knownResourceNames = resourceCatalog.resolveResourceNames(schemaOwner);
        SortedSet<String> cacheDependencies =
            dependencyResolver.resolveDependencies(policy, knownResourceNames, commandText);
        cacheDependencies.add(CacheDependencies.UNKNOWN_DEPENDENCY);

        try {
            store.invalidateByDependencyTags(cacheDependencies);
        } catch (RuntimeException e) {
            log.error("Failed to invalidate [{}] dependencies of schema owner {}",
                      CacheDependencies.format(cacheDependencies), schemaOwner, e);
            throw new CacheInvalidationException(cacheDependencies, e);
        }

        if (!settings.disableLogging() && policy.isLoggingEnabled()) {
            log.debug("Invalidated [{}] dependencies.", CacheDependencies.format(cacheDependencies));
        }
        return true;
    }
}
