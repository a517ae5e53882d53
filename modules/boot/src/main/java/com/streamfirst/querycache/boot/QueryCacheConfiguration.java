package com.streamfirst.querycache.boot;

import com.streamfirst.querycache.adapters.InMemoryCacheStoreAdapter;
import com.streamfirst.querycache.adapters.InMemorySchemaEnumeratorAdapter;
import com.streamfirst.querycache.application.*;
import com.streamfirst.querycache.domain.*;
import com.streamfirst.querycache.ports.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the invalidation engine. In-memory adapters back both ports unless the application
 * supplies its own store or schema enumerator.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(QueryCacheProperties.class)
public class QueryCacheConfiguration {

    // --- Settings ---

    @Bean
    public CacheInvalidationSettings cacheInvalidationSettings(QueryCacheProperties properties) {
        return new CacheInvalidationSettings(properties.isDisableLogging());
    }

    @Bean
    public CachePolicy defaultCachePolicy(QueryCacheProperties properties) {
        return properties.getDefaultPolicy().toCachePolicy();
    }

    // --- Adapter Beans ---

    @Bean
    @ConditionalOnMissingBean(SchemaEnumeratorPort.class)
    public SchemaEnumeratorPort schemaEnumerator(QueryCacheProperties properties) {
        InMemorySchemaEnumeratorAdapter enumerator = new InMemorySchemaEnumeratorAdapter();
        properties.getSchemas().forEach((owner, tables) ->
            enumerator.registerSchema(new SchemaOwnerId(owner), tables));
        log.info("Creating in-memory schema enumerator with {} schema owners", properties.getSchemas().size());
        return enumerator;
    }

    @Bean
    @ConditionalOnMissingBean(CacheStorePort.class)
    public CacheStorePort cacheStore() {
        log.info("Creating in-memory cache store");
        return new InMemoryCacheStoreAdapter();
    }

    // --- Application Service Beans ---

    @Bean
    public ResourceCatalog resourceCatalog(SchemaEnumeratorPort schemaEnumerator) {
        return new ResourceCatalog(schemaEnumerator);
    }

    @Bean
    public CommandClassifier commandClassifier() {
        return new CommandClassifier();
    }

    @Bean
    public TableNameExtractor tableNameExtractor() {
        return new TableNameExtractor();
    }

    @Bean
    public DependencyResolver dependencyResolver(TableNameExtractor tableNameExtractor,
                                                 CacheInvalidationSettings settings) {
        return new DependencyResolver(tableNameExtractor, settings);
    }

    @Bean
    public InvalidationCoordinator invalidationCoordinator(CommandClassifier commandClassifier,
                                                           ResourceCatalog resourceCatalog,
                                                           DependencyResolver dependencyResolver,
                                                           CacheInvalidationSettings settings) {
        return new InvalidationCoordinator(commandClassifier, resourceCatalog, dependencyResolver, settings);
    }

    @Bean
    public CacheDependenciesProcessor cacheDependenciesProcessor(ResourceCatalog resourceCatalog,
                                                                 CommandClassifier commandClassifier,
                                                                 DependencyResolver dependencyResolver,
                                                                 InvalidationCoordinator invalidationCoordinator,
                                                                 CacheStorePort cacheStore) {
        return new CacheDependenciesProcessor(
            resourceCatalog, commandClassifier, dependencyResolver, invalidationCoordinator, cacheStore);
    }

    // --- Demo ---

    @Bean
    @ConditionalOnProperty(prefix = "query-cache.demo", name = "enabled", havingValue = "true")
    public QueryCacheDemoRunner queryCacheDemoRunner(CacheDependenciesProcessor processor,
                                                     CacheStorePort cacheStore,
                                                     SchemaEnumeratorPort schemaEnumerator,
                                                     CachePolicy defaultCachePolicy) {
        return new QueryCacheDemoRunner(processor, cacheStore, schemaEnumerator, defaultCachePolicy);
    }
}
