package dev.eureka.search;

import java.util.List;

/**
 * One page of ranked results.
 *
 * @param query the query as submitted
 * @param hits results on this page, best first
 * @param page 1-based page number
 * @param pageSize requested results per page
 * @param totalResults results across all pages
 * @param totalPages page count, at least 1 even without results
 * @param cacheHit whether the page was served from the query cache
 */
public record SearchPage(
    String query,
    List<SearchHit> hits,
    int page,
    int pageSize,
    int totalResults,
    int totalPages,
    boolean cacheHit) {

  public SearchPage {
    hits = List.copyOf(hits);
  }

  /** Copy of this page flagged as served from the cache. */
  public SearchPage fromCache() {
    return new SearchPage(query, hits, page, pageSize, totalResults, totalPages, true);
  }

  public boolean hasNextPage() {
    return page < totalPages;
  }
}
