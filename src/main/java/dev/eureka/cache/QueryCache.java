package dev.eureka.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Result-page cache for search queries, keyed by normalized query, page and page size.
 *
 * @param <V> cached page type
 */
public class QueryCache<V> {

  private static final Logger log = LoggerFactory.getLogger(QueryCache.class);

  private final LruTtlCache<QueryKey, V> cache;

  public QueryCache(int capacity, Duration ttl, Clock clock) {
    this.cache = new LruTtlCache<>(capacity, ttl, clock);
  }

  public Optional<V> getResults(String query, int page, int pageSize) {
    return cache.get(QueryKey.of(query, page, pageSize));
  }

  public void cacheResults(String query, V results, int page, int pageSize) {
    cache.put(QueryKey.of(query, page, pageSize), results);
  }

  /** Drops every cached page of the query. */
  public void invalidate(String query) {
    String normalized = QueryKey.normalize(query);
    int removed = cache.removeIf(key -> key.normalizedQuery().equals(normalized));
    log.debug("Invalidated {} cached pages for query '{}'", removed, normalized);
  }

  public void invalidateAll() {
    cache.clear();
    log.info("Query cache cleared");
  }

  public CacheStats getStats() {
    return cache.stats();
  }

  public void resetStats() {
    cache.resetStats();
  }
}
