package dev.eureka.crawl;

import dev.eureka.index.MarkupTraversal;
import dev.eureka.index.ParsedPage;
import dev.eureka.store.IndexStore;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes one fetched page into the index: its title, its outbound link edges and one posting per
 * distinct term.
 */
@Service
public class PageIndexer {

  private static final Logger log = LoggerFactory.getLogger(PageIndexer.class);

  private final IndexStore indexStore;

  public PageIndexer(IndexStore indexStore) {
    this.indexStore = indexStore;
  }

  /**
   * Indexes the markup of a page.
   *
   * <p>Link targets are resolved against {@code url}; targets that do not resolve to an http(s)
   * URL are dropped. Every resolved target gets a document id and an edge from this page, whether
   * or not it will be crawled later.
   *
   * @param documentId id of the page being indexed
   * @param url canonical URL of the page
   * @param html the page body
   * @return the written title, links and term count
   */
  public IndexedPage index(long documentId, String url, String html) {
    ParsedPage page = MarkupTraversal.traverse(html, url);

    if (page.title() != null) {
      indexStore.setTitleIfAbsent(documentId, page.title());
    }

    Set<String> links = new LinkedHashSet<>();
    for (String href : page.hrefs()) {
      Optional<String> target = UrlCanonicalizer.resolve(url, href);
      if (target.isEmpty()) {
        log.debug("Dropping link {} on {}", href, url);
        continue;
      }
      if (links.add(target.get())) {
        long targetId = indexStore.upsertDocument(target.get());
        indexStore.addLink(documentId, targetId);
      }
    }

    Map<Long, Integer> weightsByTermId = new LinkedHashMap<>();
    page.termWeights()
        .forEach((term, weight) -> weightsByTermId.put(indexStore.upsertTerm(term), weight));
    indexStore.putPostings(documentId, weightsByTermId);

    log.debug("Indexed {} ({} terms, {} links)", url, weightsByTermId.size(), links.size());
    return new IndexedPage(
        documentId, page.title(), List.copyOf(links), weightsByTermId.size());
  }
}
