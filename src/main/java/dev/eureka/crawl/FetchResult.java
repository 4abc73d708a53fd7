package dev.eureka.crawl;

import org.jspecify.annotations.Nullable;

/** Result of fetching a single URL: the response body, or why there is none. */
public record FetchResult(
    String url, @Nullable String body, boolean success, @Nullable String errorMessage) {

  public static FetchResult success(String url, String body) {
    return new FetchResult(url, body, true, null);
  }

  public static FetchResult failure(String url, String errorMessage) {
    return new FetchResult(url, null, false, errorMessage);
  }
}
