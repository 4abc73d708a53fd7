package dev.eureka.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded map with least-recently-used eviction and per-entry time-to-live.
 *
 * <p>An entry is live while no more than {@code ttl} has passed since it was last put. Expired
 * entries are removed when a lookup reaches them. A lookup hit makes the entry the most recently
 * used one; inserting a new key into a full cache evicts the least recently used entry.
 *
 * <p>Every operation runs under one lock, so the cache can be shared between threads.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class LruTtlCache<K, V> {

  private final int capacity;
  private final Duration ttl;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<K, Entry<V>> entries;

  private long hits;
  private long misses;
  private long evictions;

  public LruTtlCache(int capacity, Duration ttl, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be at least 1, got: " + capacity);
    }
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
    }
    this.capacity = capacity;
    this.ttl = ttl;
    this.clock = clock;
    this.entries = new LinkedHashMap<>(16, 0.75f, true);
  }

  /** Returns the live value for the key, counting a hit or a miss. */
  public Optional<V> get(K key) {
    lock.lock();
    try {
      Entry<V> entry = entries.get(key);
      if (entry == null) {
        misses++;
        return Optional.empty();
      }
      if (isExpired(entry, clock.instant())) {
        entries.remove(key);
        misses++;
        return Optional.empty();
      }
      hits++;
      return Optional.of(entry.value());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stores the value. An existing key is overwritten and its age reset; a new key evicts the
   * least recently used entry when the cache is full.
   */
  public void put(K key, V value) {
    lock.lock();
    try {
      Entry<V> entry = new Entry<>(value, clock.instant());
      if (entries.containsKey(key)) {
        entries.put(key, entry);
        return;
      }
      if (entries.size() >= capacity) {
        Iterator<K> eldest = entries.keySet().iterator();
        eldest.next();
        eldest.remove();
        evictions++;
      }
      entries.put(key, entry);
    } finally {
      lock.unlock();
    }
  }

  public boolean remove(K key) {
    lock.lock();
    try {
      return entries.remove(key) != null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every entry whose key matches.
   *
   * @return number of entries removed
   */
  public int removeIf(Predicate<? super K> keyPredicate) {
    lock.lock();
    try {
      int removed = 0;
      Iterator<Map.Entry<K, Entry<V>>> iterator = entries.entrySet().iterator();
      while (iterator.hasNext()) {
        if (keyPredicate.test(iterator.next().getKey())) {
          iterator.remove();
          removed++;
        }
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    lock.lock();
    try {
      entries.clear();
    } finally {
      lock.unlock();
    }
  }

  /** Number of stored entries, including expired ones no lookup has reached yet. */
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** Whether the key is stored, without touching recency or counters. */
  public boolean containsKey(K key) {
    lock.lock();
    try {
      return entries.containsKey(key);
    } finally {
      lock.unlock();
    }
  }

  public CacheStats stats() {
    lock.lock();
    try {
      return new CacheStats(entries.size(), capacity, hits, misses, evictions);
    } finally {
      lock.unlock();
    }
  }

  public void resetStats() {
    lock.lock();
    try {
      hits = 0;
      misses = 0;
      evictions = 0;
    } finally {
      lock.unlock();
    }
  }

  private boolean isExpired(Entry<V> entry, Instant now) {
    return Duration.between(entry.insertedAt(), now).compareTo(ttl) > 0;
  }

  private record Entry<V>(V value, Instant insertedAt) {}
}
