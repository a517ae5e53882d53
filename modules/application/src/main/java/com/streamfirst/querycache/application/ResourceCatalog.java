package com.streamfirst.querycache.application;

import com.streamfirst.querycache.domain.SchemaEnumerationException;
import com.streamfirst.querycache.domain.SchemaOwnerId;
import com.streamfirst.querycache.ports.SchemaEnumeratorPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoized table names per schema owner.
 * Each owner is enumerated once through the {@link SchemaEnumeratorPort}; the resulting set is
 * shared read-only for the lifetime of this catalog, as schemas are static while the process runs.
 */
@Slf4j
@RequiredArgsConstructor
public class ResourceCatalog {

    private final SchemaEnumeratorPort schemaEnumerator;
    private final Map<SchemaOwnerId, CompletableFuture<SortedSet<String>>> resourceNames = new ConcurrentHashMap<>();

    /**
     * Returns the table names of a schema owner, enumerating them on first use.
     * The first caller for an owner runs the enumeration outside the map's locks; concurrent callers
     * for the same owner wait on its cell and observe the same result. Callers for other owners never
     * wait. A failed enumeration is not cached.
     *
     * @param schemaOwner the data model the command was issued against
     * @return unmodifiable, sorted set of table names
     * @throws SchemaEnumerationException if the schema cannot be enumerated
     */
    public SortedSet<String> resolveResourceNames(@NonNull SchemaOwnerId schemaOwner) {
        CompletableFuture<SortedSet<String>> created = new CompletableFuture<>();
        CompletableFuture<SortedSet<String>> cell = resourceNames.putIfAbsent(schemaOwner, created);
        if (cell != null) {
            return await(cell);
        }

        try {
            SortedSet<String> names = enumerate(schemaOwner);
            created.complete(names);
            return names;
        } catch (RuntimeException | Error e) {
            resourceNames.remove(schemaOwner, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Returns true if the owner's table names have already been enumerated.
     */
    public boolean isResolved(SchemaOwnerId schemaOwner) {
        CompletableFuture<SortedSet<String>> cell = resourceNames.get(schemaOwner);
        return cell != null && cell.isDone() && !cell.isCompletedExceptionally();
    }

    /**
     * Number of schema owners enumerated so far.
     */
    public int size() {
        return (int) resourceNames.values().stream()
            .filter(cell -> cell.isDone() && !cell.isCompletedExceptionally())
            .count();
    }

    private static SortedSet<String> await(CompletableFuture<SortedSet<String>> cell) {
        try {
            return cell.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private SortedSet<String> enumerate(SchemaOwnerId schemaOwner) {
        log.debug("Enumerating resource names of schema owner {}", schemaOwner);

        SortedSet<String> enumerated;
        try {
            enumerated = schemaEnumerator.enumerateResourceNames(schemaOwner);
        } catch (SchemaEnumerationException e) {
            log.error("Failed to enumerate resource names of schema owner {}", schemaOwner, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to enumerate resource names of schema owner {}", schemaOwner, e);
            throw new SchemaEnumerationException(schemaOwner, e.getMessage(), e);
        }

        if (enumerated == null) {
            throw new SchemaEnumerationException(schemaOwner, "enumerator returned no result", null);
        }

        SortedSet<String> names = new TreeSet<>();
        enumerated.stream()
            .filter(name -> name != null && !name.isBlank())
            .forEach(names::add);

        log.info("Resolved {} resource names for schema owner {}", names.size(), schemaOwner);
        return Collections.unmodifiableSortedSet(names);
    }
}
