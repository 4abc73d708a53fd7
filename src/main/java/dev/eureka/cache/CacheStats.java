package dev.eureka.cache;

/**
 * Snapshot of cache counters.
 *
 * @param size entries currently stored (expired entries not yet purged included)
 * @param capacity maximum number of entries
 * @param hits lookups answered from the cache
 * @param misses lookups that found no live entry
 * @param evictions entries dropped to make room for new keys
 */
public record CacheStats(int size, int capacity, long hits, long misses, long evictions) {

  /** Fraction of lookups that hit, 0.0 before the first lookup. */
  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
