package dev.eureka.search;

import dev.eureka.cache.CacheStats;
import dev.eureka.cache.QueryCache;
import dev.eureka.index.Tokenizer;
import dev.eureka.ranking.RankedResult;
import dev.eureka.ranking.Ranker;
import dev.eureka.snippet.SnippetGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serving facade: cache lookup, ranking, pagination and snippets.
 *
 * <p>Pipeline: look up the page in the query cache -> on a miss tokenize the query exactly as
 * page text is tokenized -> rank (single or multi term) -> cut the requested page -> highlight
 * query terms in titles -> store the page in the cache.
 *
 * <p>The cache is never authoritative: a failing cache is logged and bypassed, and the search is
 * answered by the ranker.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final Ranker ranker;
  private final QueryCache<SearchPage> queryCache;
  private final SnippetGenerator snippetGenerator;
  private final SearchProperties properties;

  public SearchService(
      Ranker ranker,
      QueryCache<SearchPage> queryCache,
      SnippetGenerator snippetGenerator,
      SearchProperties properties) {
    this.ranker = ranker;
    this.queryCache = queryCache;
    this.snippetGenerator = snippetGenerator;
    this.properties = properties;
  }

  /**
   * Answers one page of a search.
   *
   * @param request query and page coordinates
   * @return the page, flagged with whether it came from the cache
   */
  public SearchPage search(SearchRequest request) {
    Optional<SearchPage> cached = lookup(request);
    if (cached.isPresent()) {
      log.debug("Cache hit for '{}' page {}", request.query(), request.page());
      return cached.get().fromCache();
    }

    List<String> terms = Tokenizer.tokenize(request.query());
    List<RankedResult> ranked = rank(terms);

    int total = ranked.size();
    int totalPages = Math.max(1, (total + request.pageSize() - 1) / request.pageSize());
    long from = (long) (request.page() - 1) * request.pageSize();
    List<SearchHit> hits = new ArrayList<>();
    if (from < total) {
      int to = (int) Math.min(total, from + request.pageSize());
      for (RankedResult result : ranked.subList((int) from, to)) {
        hits.add(toHit(result, terms));
      }
    }

    SearchPage page =
        new SearchPage(
            request.query(), hits, request.page(), request.pageSize(), total, totalPages, false);
    store(request, page);
    log.debug(
        "Search '{}' -> {} terms, {} results, page {}/{}",
        request.query(),
        terms.size(),
        total,
        request.page(),
        totalPages);
    return page;
  }

  public CacheStats cacheStats() {
    return queryCache.getStats();
  }

  /** Drops every cached page of the query. */
  public void invalidateCache(String query) {
    queryCache.invalidate(query);
  }

  /** Drops every cached page, e.g. after the index has changed. */
  public void invalidateAll() {
    queryCache.invalidateAll();
  }

  private List<RankedResult> rank(List<String> terms) {
    if (terms.isEmpty()) {
      return List.of();
    }
    if (terms.size() == 1) {
      return ranker.rankSingleTerm(terms.get(0), properties.getMaxResults());
    }
    return ranker.rankMultiTerm(terms, properties.getMaxResults());
  }

  private SearchHit toHit(RankedResult result, List<String> terms) {
    String snippet = result.title() == null ? "" : snippetGenerator.generate(result.title(), terms);
    return new SearchHit(
        result.url(), result.title(), snippet, result.score(), result.importanceScore());
  }

  private Optional<SearchPage> lookup(SearchRequest request) {
    try {
      return queryCache.getResults(request.query(), request.page(), request.pageSize());
    } catch (RuntimeException e) {
      log.warn("Query cache lookup failed, ranking without cache: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private void store(SearchRequest request, SearchPage page) {
    try {
      queryCache.cacheResults(request.query(), page, request.page(), request.pageSize());
    } catch (RuntimeException e) {
      log.warn("Failed to cache results for '{}': {}", request.query(), e.getMessage());
    }
  }
}
