package dev.eureka.crawl;

import java.util.List;

/**
 * Outcome of one crawl run.
 *
 * @param indexedUrls pages fetched and indexed, in crawl order
 * @param failedUrls pages whose fetch or indexing failed
 * @param rejectedSeeds seeds dropped because they were not valid http(s) URLs
 * @param documentsKnown documents in the store after the run, including linked-only ones
 */
public record CrawlReport(
    List<String> indexedUrls,
    List<String> failedUrls,
    List<String> rejectedSeeds,
    long documentsKnown) {

  public CrawlReport {
    indexedUrls = List.copyOf(indexedUrls);
    failedUrls = List.copyOf(failedUrls);
    rejectedSeeds = List.copyOf(rejectedSeeds);
  }

  public int pagesIndexed() {
    return indexedUrls.size();
  }
}
