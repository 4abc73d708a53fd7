package dev.eureka.search;

/**
 * One page of a search.
 *
 * @param query the search query text (must not be null or blank)
 * @param page 1-based page number (must be >= 1)
 * @param pageSize results per page (must be >= 1)
 */
public record SearchRequest(String query, int page, int pageSize) {

  /** Default number of results per page when not specified. */
  public static final int DEFAULT_PAGE_SIZE = 10;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be at least 1");
    }
  }

  /** Convenience constructor for the first page with the default page size. */
  public SearchRequest(String query) {
    this(query, 1, DEFAULT_PAGE_SIZE);
  }
}
