package dev.eureka.pagerank;

import dev.eureka.store.IndexStore;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Recomputes document importance from the stored link graph and publishes it atomically. */
@Service
public class PageRankService {

  private static final Logger log = LoggerFactory.getLogger(PageRankService.class);

  private final IndexStore indexStore;
  private final PageRankProperties properties;

  public PageRankService(IndexStore indexStore, PageRankProperties properties) {
    this.indexStore = indexStore;
    this.properties = properties;
  }

  /**
   * Loads the link graph, computes normalized PageRank and overwrites every importance score.
   *
   * @return the published scores
   */
  public Map<Long, Double> recompute() {
    Map<Long, List<Long>> graph = indexStore.getLinkGraph();
    if (graph.isEmpty()) {
      log.info("Link graph is empty, skipping PageRank");
      return Map.of();
    }

    long start = System.nanoTime();
    Map<Long, Double> scores =
        PageRankEngine.normalize(
            PageRankEngine.compute(graph, properties.getIterations(), properties.getDamping()));
    indexStore.updatePageRanks(scores);
    log.info(
        "PageRank over {} documents ({} iterations) took {} ms",
        scores.size(),
        properties.getIterations(),
        (System.nanoTime() - start) / 1_000_000);
    return scores;
  }
}
