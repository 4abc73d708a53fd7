package dev.eureka.cli;

import dev.eureka.crawl.CrawlProperties;
import dev.eureka.crawl.CrawlReport;
import dev.eureka.crawl.CrawlService;
import dev.eureka.crawl.SeedFileReader;
import dev.eureka.pagerank.PageRankService;
import dev.eureka.search.SearchService;
import dev.eureka.store.IndexStatistics;
import dev.eureka.store.IndexStore;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch crawl run at startup: seeds -> crawl -> PageRank -> cache invalidation -> statistics.
 *
 * <p>Active only when {@code eureka.crawl.seed-file} is set.
 */
@Component
@ConditionalOnProperty(prefix = "eureka.crawl", name = "seed-file")
public class CrawlCommandRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(CrawlCommandRunner.class);

  private final CrawlService crawlService;
  private final PageRankService pageRankService;
  private final SearchService searchService;
  private final IndexStore indexStore;
  private final CrawlProperties properties;

  public CrawlCommandRunner(
      CrawlService crawlService,
      PageRankService pageRankService,
      SearchService searchService,
      IndexStore indexStore,
      CrawlProperties properties) {
    this.crawlService = crawlService;
    this.pageRankService = pageRankService;
    this.searchService = searchService;
    this.indexStore = indexStore;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> seeds = readSeeds(Path.of(properties.seedFile()));
    if (seeds.isEmpty()) {
      log.warn("No seeds to crawl in {}", properties.seedFile());
      return;
    }

    CrawlReport report = crawlService.crawl(seeds);
    pageRankService.recompute();
    searchService.invalidateAll();

    IndexStatistics statistics = indexStore.getStatistics();
    log.info(
        "Crawl complete: {} pages indexed, {} failed, {} seeds rejected",
        report.pagesIndexed(),
        report.failedUrls().size(),
        report.rejectedSeeds().size());
    log.info(
        "Index now holds {} terms, {} documents, {} postings, {} links",
        statistics.terms(),
        statistics.documents(),
        statistics.postings(),
        statistics.links());
  }

  private List<String> readSeeds(Path seedFile) {
    try {
      return SeedFileReader.read(seedFile);
    } catch (UncheckedIOException e) {
      log.error("Cannot read seed file {}: {}", seedFile, e.getCause().getMessage());
      return List.of();
    }
  }
}
