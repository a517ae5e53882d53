package com.streamfirst.querycache.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Validation and helper behavior of the small domain value types.
 */
class DomainValuesTest {

    static class SalesContext {
    }

    @Test
    void testSchemaOwnerIdValidation() {
        assertThrows(NullPointerException.class, () -> new SchemaOwnerId(null));
        assertThrows(IllegalArgumentException.class, () -> new SchemaOwnerId("  "));
    }

    @Test
    void testSchemaOwnerIdFromType() {
        SchemaOwnerId owner = SchemaOwnerId.of(SalesContext.class);

        assertThat(owner).isEqualTo(SchemaOwnerId.of(SalesContext.class));
        assertThat(owner.name()).isEqualTo(SalesContext.class.getName());
        assertThat(owner).hasToString(SalesContext.class.getName());
    }

    @Test
    void testUnknownDependencySet() {
        assertThat(CacheDependencies.unknown()).containsExactly("UnknownDependency");
        assertThat(CacheDependencies.UNKNOWN_DEPENDENCY).isEqualTo("UnknownDependency");
    }

    @Test
    void testFormatJoinsInOrder() {
        assertThat(CacheDependencies.format(new TreeSet<>(Set.of("Users", "Orders")))).isEqualTo("Orders, Users");
        assertThat(CacheDependencies.format(null)).isEmpty();
    }

    @Test
    void testCachedResultRequiresDependencies() {
        assertThrows(IllegalArgumentException.class,
            () -> new CachedResult("value", List.of(), CachePolicy.defaultPolicy()));
        assertThrows(NullPointerException.class,
            () -> new CachedResult("value", List.of("Orders"), null));

        CachedResult result = new CachedResult("value", List.of("Users", "Orders"), CachePolicy.defaultPolicy());
        assertThat(result.getCacheDependencies()).containsExactly("Orders", "Users");
    }

    @Test
    void testCacheInvalidationExceptionKeepsTags() {
        RuntimeException cause = new RuntimeException("store down");
        CacheInvalidationException exception =
            new CacheInvalidationException(new TreeSet<>(Set.of("Products", "UnknownDependency")), cause);

        assertThat(exception.getCacheDependencies()).containsExactly("Products", "UnknownDependency");
        assertThat(exception).hasMessageContaining("Products, UnknownDependency").hasCause(cause);
    }
}
