package dev.eureka.crawl;

import dev.eureka.store.IndexStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Breadth-first crawl from a seed list up to a maximum link depth.
 *
 * <p>Each page is fetched, indexed and its outbound links are queued one level deeper. Pages are
 * deduplicated by document id, so a URL reachable along several paths (or listed twice as a seed)
 * is fetched at most once per run. A page that fails to fetch or index is logged and recorded in
 * the report; the crawl carries on with the rest of the frontier.
 */
@Service
public class CrawlService {

  private static final Logger log = LoggerFactory.getLogger(CrawlService.class);

  private final PageFetcher pageFetcher;
  private final PageIndexer pageIndexer;
  private final IndexStore indexStore;
  private final CrawlProperties properties;

  public CrawlService(
      PageFetcher pageFetcher,
      PageIndexer pageIndexer,
      IndexStore indexStore,
      CrawlProperties properties) {
    this.pageFetcher = pageFetcher;
    this.pageIndexer = pageIndexer;
    this.indexStore = indexStore;
    this.properties = properties;
  }

  /** Crawls with the configured {@code eureka.crawl.max-depth}. */
  public CrawlReport crawl(List<String> seeds) {
    return crawl(seeds, properties.maxDepth());
  }

  /**
   * Crawls from the seeds.
   *
   * @param seeds absolute http(s) URLs; invalid entries are skipped and reported
   * @param maxDepth link hops to follow; 0 indexes the seeds only
   * @return indexed, failed and rejected URLs
   */
  public CrawlReport crawl(List<String> seeds, int maxDepth) {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must not be negative");
    }

    Deque<FrontierEntry> frontier = new ArrayDeque<>();
    List<String> rejectedSeeds = new ArrayList<>();
    for (String seed : seeds) {
      Optional<String> canonical = UrlCanonicalizer.canonicalize(seed);
      if (canonical.isPresent()) {
        frontier.add(new FrontierEntry(canonical.get(), 0));
      } else {
        log.warn("Ignoring invalid seed URL: {}", seed);
        rejectedSeeds.add(seed);
      }
    }
    log.info("Starting crawl of {} seeds, max depth {}", frontier.size(), maxDepth);

    Set<Long> seen = new HashSet<>();
    List<String> indexed = new ArrayList<>();
    List<String> failed = new ArrayList<>();

    while (!frontier.isEmpty()) {
      FrontierEntry entry = frontier.poll();
      try {
        long documentId = indexStore.upsertDocument(entry.url());
        if (!seen.add(documentId)) {
          continue;
        }
        if (crawlPage(documentId, entry, maxDepth, frontier)) {
          indexed.add(entry.url());
        } else {
          failed.add(entry.url());
        }
      } catch (RuntimeException e) {
        log.error("Error crawling {}: {}", entry.url(), e.getMessage(), e);
        failed.add(entry.url());
      }
    }

    log.info("Crawl finished: {} pages indexed, {} failed", indexed.size(), failed.size());
    return new CrawlReport(indexed, failed, rejectedSeeds, indexStore.countDocuments());
  }

  private boolean crawlPage(
      long documentId, FrontierEntry entry, int maxDepth, Deque<FrontierEntry> frontier) {
    FetchResult result = pageFetcher.fetch(entry.url());
    if (!result.success()) {
      log.warn("Failed to fetch {}: {}", entry.url(), result.errorMessage());
      return false;
    }

    IndexedPage page =
        pageIndexer.index(documentId, entry.url(), result.body() == null ? "" : result.body());
    log.info("Indexed {} (depth {}, {} links)", entry.url(), entry.depth(), page.links().size());

    int nextDepth = entry.depth() + 1;
    if (nextDepth <= maxDepth) {
      for (String link : page.links()) {
        frontier.add(new FrontierEntry(link, nextDepth));
      }
    }
    return true;
  }

  private record FrontierEntry(String url, int depth) {}
}
