package dev.eureka.crawl;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * What indexing one page wrote to the store.
 *
 * @param documentId the page's document id
 * @param title the page title, null if it has none
 * @param links canonical outbound link targets, deduplicated, in document order
 * @param termCount distinct terms posted for the page
 */
public record IndexedPage(
    long documentId, @Nullable String title, List<String> links, int termCount) {

  public IndexedPage {
    links = List.copyOf(links);
  }
}
