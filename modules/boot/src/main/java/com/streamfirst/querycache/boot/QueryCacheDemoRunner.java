package com.streamfirst.querycache.boot;

import com.streamfirst.querycache.adapters.InMemorySchemaEnumeratorAdapter;
import com.streamfirst.querycache.application.CacheDependenciesProcessor;
import com.streamfirst.querycache.domain.CachePolicy;
import com.streamfirst.querycache.domain.CachedResult;
import com.streamfirst.querycache.domain.SchemaOwnerId;
import com.streamfirst.querycache.ports.CacheStorePort;
import com.streamfirst.querycache.ports.SchemaEnumeratorPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

import java.util.List;
import java.util.SortedSet;

/**
 * Walks through a read, a write and a repeated read against the configured store, showing the
 * cached entry being purged by the write.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryCacheDemoRunner implements CommandLineRunner {

    static final SchemaOwnerId DEMO_OWNER = new SchemaOwnerId("demo");
    static final String READ_COMMAND = "SELECT [p].[Id], [p].[Title] FROM [dbo].[Posts] AS [p]";
    static final String WRITE_COMMAND = "INSERT INTO [dbo].[Posts] ([Title], [UserId]) VALUES (@p0, @p1)";

    private final CacheDependenciesProcessor processor;
    private final CacheStorePort cacheStore;
    private final SchemaEnumeratorPort schemaEnumerator;
    private final CachePolicy defaultPolicy;

    @Override
    public void run(String... args) {
        log.info("--- Starting query cache invalidation demo ---");

        if (schemaEnumerator instanceof InMemorySchemaEnumeratorAdapter enumerator
            && !enumerator.getRegisteredOwners().contains(DEMO_OWNER)) {
            enumerator.registerSchema(DEMO_OWNER, "Posts", "Users");
        }

        // 1. Read: resolve dependencies and cache the result
        SortedSet<String> dependencies = processor.resolveReadDependencies(defaultPolicy, DEMO_OWNER, READ_COMMAND);
        cacheStore.put(READ_COMMAND, new CachedResult(List.of("Title 1"), dependencies, defaultPolicy));
        log.info("STEP 1: Cached read tagged with {}", dependencies);

        // 2. Repeat the read
        boolean hit = cacheStore.get(READ_COMMAND).isPresent();
        log.info("STEP 2: Repeated read served from cache: {}", hit);

        // 3. Write to the same table
        boolean invalidated = processor.invalidateIfMutating(WRITE_COMMAND, DEMO_OWNER, defaultPolicy);
        log.info("STEP 3: Insert invalidated dependent entries: {}", invalidated);

        // 4. Read again
        boolean stillCached = cacheStore.get(READ_COMMAND).isPresent();
        log.info("STEP 4: Read after insert served from cache: {}", stillCached);
        if (stillCached) {
            throw new IllegalStateException("Expected the insert to purge the cached read");
        }

        log.info("--- Demo finished successfully ---");
    }
}
