package dev.eureka.cache;

import java.util.Locale;

/**
 * Cache key of one result page.
 *
 * @param normalizedQuery query text, stripped and lower-cased
 * @param page 1-based page number
 * @param pageSize results per page
 */
public record QueryKey(String normalizedQuery, int page, int pageSize) {

  public static QueryKey of(String query, int page, int pageSize) {
    return new QueryKey(normalize(query), page, pageSize);
  }

  /** Strips surrounding whitespace and lower-cases, so "Java " and "java" share entries. */
  public static String normalize(String query) {
    return query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
  }
}
