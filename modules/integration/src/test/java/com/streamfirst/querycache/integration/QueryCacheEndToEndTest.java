package com.streamfirst.querycache.integration;

import com.streamfirst.querycache.adapters.*;
import com.streamfirst.querycache.application.*;
import com.streamfirst.querycache.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of the invalidation engine against the in-memory adapters.
 * Plays the role of the command pipeline: reads resolve dependencies and populate the store,
 * every executed command is then offered for invalidation.
 */
@Slf4j
public class QueryCacheEndToEndTest {

    private static final SchemaOwnerId SHOP = new SchemaOwnerId("shop");
    private static final SchemaOwnerId BLOG = new SchemaOwnerId("blog");

    private static final String READ_PRODUCTS = "SELECT * FROM Products";
    private static final String READ_USERS = "SELECT [u].[Id], [u].[Name] FROM [dbo].[Users] AS [u]";
    private static final String READ_PROCEDURE = "EXEC usp_GetBlogData 1";

    private InMemorySchemaEnumeratorAdapter schemaEnumerator;
    private InMemoryCacheStoreAdapter cacheStore;
    private CacheDependenciesProcessor processor;

    @BeforeEach
    void setupEngine() {
        schemaEnumerator = new InMemorySchemaEnumeratorAdapter();
        schemaEnumerator.registerSchema(SHOP, "Products", "Users", "Orders");
        schemaEnumerator.registerSchema(BLOG, "Posts", "Users");

        cacheStore = new InMemoryCacheStoreAdapter();

        CacheInvalidationSettings settings = CacheInvalidationSettings.defaults();
        ResourceCatalog catalog = new ResourceCatalog(schemaEnumerator);
        CommandClassifier classifier = new CommandClassifier();
        DependencyResolver resolver = new DependencyResolver(new TableNameExtractor(), settings);
        InvalidationCoordinator coordinator = new InvalidationCoordinator(classifier, catalog, resolver, settings);
        processor = new CacheDependenciesProcessor(catalog, classifier, resolver, coordinator, cacheStore);
    }

    /**
     * Read, cache, write the same table, read again.
     * The write must turn the second read into a cache miss.
     */
    @Test
    void testInsertInvalidatesCachedRead() {
        CachePolicy policy = CachePolicy.defaultPolicy();

        assertTrue(executeRead(SHOP, READ_PRODUCTS, policy).isEmpty(), "First read should miss");
        assertTrue(executeRead(SHOP, READ_PRODUCTS, policy).isPresent(), "Second read should hit");
        assertEquals(List.of(READ_PRODUCTS), List.copyOf(cacheStore.getKeysForDependency("Products")));

        boolean invalidated = executeCommand(SHOP,
            "INSERT INTO Products (Name, Price) VALUES ('Product1', 10)", policy);

        assertTrue(invalidated, "Insert should invalidate");
        assertTrue(executeRead(SHOP, READ_PRODUCTS, policy).isEmpty(), "Read after insert should miss");
        assertEquals(2, cacheStore.getMissCount());
        assertEquals(1, cacheStore.getHitCount());
    }

    /**
     * A write to one table keeps results of unrelated known tables cached.
     */
    @Test
    void testWriteToOtherTableKeepsEntry() {
        CachePolicy policy = CachePolicy.defaultPolicy();
        executeRead(SHOP, READ_USERS, policy);

        executeCommand(SHOP, "UPDATE [dbo].[Orders] SET [Total] = @p0 WHERE [Id] = @p1", policy);

        assertTrue(executeRead(SHOP, READ_USERS, policy).isPresent(), "Users read should survive an Orders write");
    }

    /**
     * Reads that cannot be tied to a table are purged by any write, even an unrelated one.
     */
    @Test
    void testUnresolvableReadIsPurgedByAnyWrite() {
        CachePolicy policy = CachePolicy.defaultPolicy();
        executeRead(BLOG, READ_PROCEDURE, policy);
        assertEquals(List.of(READ_PROCEDURE),
            List.copyOf(cacheStore.getKeysForDependency(CacheDependencies.UNKNOWN_DEPENDENCY)));

        executeCommand(BLOG, "DELETE FROM [Users] WHERE [Id] = 7", policy);

        assertTrue(executeRead(BLOG, READ_PROCEDURE, policy).isEmpty(),
            "Entry tagged with the sentinel should be purged by every write");
    }

    /**
     * Explicit dependencies tie a procedure call to the tables it reads.
     */
    @Test
    void testExplicitDependenciesTieProcedureToTable() {
        CachePolicy postsPolicy = CachePolicy.withDependencies("Posts");
        executeRead(BLOG, READ_PROCEDURE, postsPolicy);

        executeCommand(BLOG, "SELECT * FROM Posts", CachePolicy.defaultPolicy());
        assertTrue(executeRead(BLOG, READ_PROCEDURE, postsPolicy).isPresent(), "Reads never invalidate");

        executeCommand(BLOG, "INSERT INTO [Posts] ([Title]) VALUES (@p0)", CachePolicy.defaultPolicy());
        assertTrue(executeRead(BLOG, READ_PROCEDURE, postsPolicy).isEmpty(), "Posts write should purge the call");
    }

    /**
     * Schema owners keep separate catalogs, each enumerated only once.
     */
    @Test
    void testCatalogsArePerOwnerAndMemoized() {
        CachePolicy policy = CachePolicy.defaultPolicy();

        SortedSet<String> shopDependencies = processor.resolveReadDependencies(policy, SHOP, "SELECT * FROM Posts");
        SortedSet<String> blogDependencies = processor.resolveReadDependencies(policy, BLOG, "SELECT * FROM Posts");
        processor.resolveReadDependencies(policy, BLOG, READ_USERS);

        assertEquals(CacheDependencies.unknown(), shopDependencies, "Posts is not a shop table");
        assertEquals(List.of("Posts"), List.copyOf(blogDependencies));
        assertEquals(2, schemaEnumerator.getEnumerationCount());
    }

    /**
     * An owner that cannot be enumerated fails loudly instead of caching anything.
     */
    @Test
    void testUnknownOwnerIsConfigurationError() {
        SchemaOwnerId unknown = new SchemaOwnerId("missing");

        assertThrows(SchemaEnumerationException.class,
            () -> processor.resolveReadDependencies(CachePolicy.defaultPolicy(), unknown, READ_PRODUCTS));
        assertThrows(SchemaEnumerationException.class,
            () -> processor.invalidateIfMutating("DELETE FROM Products", unknown, CachePolicy.defaultPolicy()));
        assertEquals(0, cacheStore.getEntryCount());
    }

    private Optional<CachedResult> executeRead(SchemaOwnerId owner, String commandText, CachePolicy policy) {
        Optional<CachedResult> cached = cacheStore.get(commandText);
        if (cached.isEmpty()) {
            SortedSet<String> dependencies = processor.resolveReadDependencies(policy, owner, commandText);
            log.debug("Caching {} with dependencies {}", commandText, dependencies);
            cacheStore.put(commandText, new CachedResult(List.of("row"), dependencies, policy));
        }
        return cached;
    }

    private boolean executeCommand(SchemaOwnerId owner, String commandText, CachePolicy policy) {
        return processor.invalidateIfMutating(commandText, owner, policy);
    }
}
