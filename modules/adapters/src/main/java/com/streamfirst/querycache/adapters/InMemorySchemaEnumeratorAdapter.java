package com.streamfirst.querycache.adapters;

import com.streamfirst.querycache.domain.SchemaOwnerId;
import com.streamfirst.querycache.ports.SchemaEnumeratorPort;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of SchemaEnumeratorPort for testing and development. Table names are
 * registered per schema owner up front; enumerating an unregistered owner is a configuration error.
 */
@Slf4j
public class InMemorySchemaEnumeratorAdapter implements SchemaEnumeratorPort {

  private final Map<SchemaOwnerId, SortedSet<String>> schemas = new ConcurrentHashMap<>();
  private final AtomicInteger enumerationCount = new AtomicInteger();

  @Override
  public SortedSet<String> enumerateResourceNames(SchemaOwnerId schemaOwner) {
    enumerationCount.incrementAndGet();

    SortedSet<String> tableNames = schemas.get(schemaOwner);
    if (tableNames == null) {
      throw new IllegalArgumentException("Schema owner " + schemaOwner + " is not registered");
    }

    log.debug("Enumerated {} tables for schema owner {}", tableNames.size(), schemaOwner);
    return new TreeSet<>(tableNames);
  }

  /** Registers the table names declared by a schema owner, replacing any earlier registration. */
  public void registerSchema(SchemaOwnerId schemaOwner, Collection<String> tableNames) {
    Objects.requireNonNull(schemaOwner, "Schema owner cannot be null");
    Objects.requireNonNull(tableNames, "Table names cannot be null");

    schemas.put(schemaOwner, new TreeSet<>(tableNames));
    log.info("Registered schema owner {} with tables {}", schemaOwner, tableNames);
  }

  /** Convenience overload of {@link #registerSchema(SchemaOwnerId, Collection)}. */
  public void registerSchema(SchemaOwnerId schemaOwner, String... tableNames) {
    registerSchema(schemaOwner, Arrays.asList(tableNames));
  }

  /** Number of times {@link #enumerateResourceNames} has been called. */
  public int getEnumerationCount() {
    return enumerationCount.get();
  }

  /** Gets all registered schema owners. */
  public Set<SchemaOwnerId> getRegisteredOwners() {
    return Set.copyOf(schemas.keySet());
  }
}
