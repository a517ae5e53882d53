package com.streamfirst.querycache.adapters;

import com.streamfirst.querycache.domain.CacheExpirationMode;
import com.streamfirst.querycache.domain.CachedResult;
import com.streamfirst.querycache.ports.CacheStorePort;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of CacheStorePort for testing and development. Entries are indexed by
 * each of their dependency tags so a purge only touches matching keys. Expiration is evaluated
 * lazily on read against the injected clock. Data is lost when the application stops.
 *
 * <p>Reads are lock-free. Every change to the entry map and the tag index happens under one
 * monitor, so an entry written concurrently with a purge of one of its tags is either purged or
 * still reachable through that tag afterwards.
 */
@Slf4j
public class InMemoryCacheStoreAdapter implements CacheStorePort {

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> keysByTag = new ConcurrentHashMap<>();
  private final Object lock = new Object();
  private final AtomicLong hitCount = new AtomicLong();
  private final AtomicLong missCount = new AtomicLong();
  private final AtomicLong invalidatedCount = new AtomicLong();
  private final Clock clock;

  public InMemoryCacheStoreAdapter() {
    this(Clock.systemUTC());
  }

  public InMemoryCacheStoreAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  @Override
  public void put(String key, CachedResult result) {
    Objects.requireNonNull(key, "Cache key cannot be null");
    Objects.requireNonNull(result, "Cached result cannot be null");

    synchronized (lock) {
      Entry previous = entries.put(key, new Entry(result, clock.instant()));
      if (previous != null) {
        unindex(key, previous.result().getCacheDependencies());
      }
      for (String tag : result.getCacheDependencies()) {
        keysByTag.computeIfAbsent(tag, k -> ConcurrentHashMap.newKeySet()).add(key);
      }
    }

    log.debug("Cached entry {} with dependencies {}", key, result.getCacheDependencies());
  }

  @Override
  public Optional<CachedResult> get(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      missCount.incrementAndGet();
      log.debug("Cache miss for {}", key);
      return Optional.empty();
    }

    Instant now = clock.instant();
    if (entry.isExpired(now)) {
      synchronized (lock) {
        if (entries.get(key) == entry) {
          remove(key);
        }
      }
      missCount.incrementAndGet();
      log.debug("Cache entry {} expired", key);
      return Optional.empty();
    }

    entry.touch(now);
    hitCount.incrementAndGet();
    log.debug("Cache hit for {}", key);
    return Optional.of(entry.result());
  }

  @Override
  public void invalidateByDependencyTags(Set<String> cacheDependencies) {
    Objects.requireNonNull(cacheDependencies, "Cache dependencies cannot be null");

    int removed = 0;
    synchronized (lock) {
      for (String tag : cacheDependencies) {
        Set<String> keys = keysByTag.remove(tag);
        if (keys == null) {
          continue;
        }
        for (String key : keys) {
          if (remove(key)) {
            removed++;
          }
        }
      }
    }

    invalidatedCount.addAndGet(removed);
    log.info("Invalidated {} entries for dependencies {}", removed, cacheDependencies);
  }

  @Override
  public void clearAllCachedEntries() {
    synchronized (lock) {
      log.info("Clearing all {} cached entries", entries.size());
      entries.clear();
      keysByTag.clear();
    }
  }

  /** Gets the number of live and not yet evicted expired entries. */
  public int getEntryCount() {
    return entries.size();
  }

  /** Gets the keys currently indexed under a tag. */
  public Set<String> getKeysForDependency(String tag) {
    Set<String> keys = keysByTag.get(tag);
    return keys == null ? Set.of() : Set.copyOf(keys);
  }

  public long getHitCount() {
    return hitCount.get();
  }

  public long getMissCount() {
    return missCount.get();
  }

  /** Gets the total number of entries removed by tag invalidation. */
  public long getInvalidatedCount() {
    return invalidatedCount.get();
  }

  /** Resets hit, miss and invalidation counters. Useful for testing. */
  public void resetStatistics() {
    hitCount.set(0);
    missCount.set(0);
    invalidatedCount.set(0);
  }

  // Callers hold the lock.
  private boolean remove(String key) {
    Entry removed = entries.remove(key);
    if (removed == null) {
      return false;
    }
    unindex(key, removed.result().getCacheDependencies());
    return true;
  }

  private void unindex(String key, Set<String> tags) {
    for (String tag : tags) {
      keysByTag.computeIfPresent(
          tag,
          (k, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
          });
    }
  }

  private static final class Entry {
    private final CachedResult result;
    private volatile Instant lastAccess;
    private final Instant createdAt;

    private Entry(CachedResult result, Instant createdAt) {
      this.result = result;
      this.createdAt = createdAt;
      this.lastAccess = createdAt;
    }

    CachedResult result() {
      return result;
    }

    boolean isExpired(Instant now) {
      Instant since =
          result.getPolicy().getExpirationMode() == CacheExpirationMode.SLIDING
              ? lastAccess
              : createdAt;
      return !now.isBefore(since.plus(result.getPolicy().getTimeout()));
    }

    void touch(Instant now) {
      lastAccess = now;
    }
  }
}
