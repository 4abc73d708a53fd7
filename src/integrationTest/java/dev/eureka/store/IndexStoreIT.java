package dev.eureka.store;

import static org.assertj.core.api.Assertions.assertThat;

import dev.eureka.BaseIntegrationTest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class IndexStoreIT extends BaseIntegrationTest {

  @Autowired private IndexStore indexStore;

  @Test
  void upsertTermIsIdempotent() {
    long first = indexStore.upsertTerm("java");
    long second = indexStore.upsertTerm("JAVA");

    assertThat(second).isEqualTo(first);
    assertThat(indexStore.getStatistics().terms()).isEqualTo(1);
  }

  @Test
  void upsertDocumentIsIdempotent() {
    long first = indexStore.upsertDocument("http://example.com/");
    long second = indexStore.upsertDocument("http://example.com/");

    assertThat(second).isEqualTo(first);
    assertThat(indexStore.countDocuments()).isEqualTo(1);
  }

  @Test
  void concurrentUpsertsOfSameUrlShareOneId() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Callable<Long>> tasks = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        tasks.add(() -> indexStore.upsertDocument("http://example.com/race"));
      }
      Set<Long> ids = new HashSet<>();
      for (Future<Long> future : executor.invokeAll(tasks)) {
        ids.add(future.get());
      }
      assertThat(ids).hasSize(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void searchTermOrdersByImportance() {
    long term = indexStore.upsertTerm("search");
    long low = indexStore.upsertDocument("http://example.com/low");
    long high = indexStore.upsertDocument("http://example.com/high");
    long other = indexStore.upsertDocument("http://example.com/other");
    indexStore.setTitleIfAbsent(high, "High");
    indexStore.putPostings(low, Map.of(term, 0));
    indexStore.putPostings(high, Map.of(term, 7));
    indexStore.updatePageRanks(Map.of(low, 0.1, high, 0.8, other, 0.1));

    List<TermSearchHit> hits = indexStore.searchTerm("search", 10, 0);

    assertThat(hits)
        .containsExactly(
            new TermSearchHit("http://example.com/high", "High", 0.8),
            new TermSearchHit("http://example.com/low", null, 0.1));
    assertThat(indexStore.searchTerm("search", 1, 1))
        .extracting(TermSearchHit::url)
        .containsExactly("http://example.com/low");
    assertThat(indexStore.searchTerm("missing", 10, 0)).isEmpty();
  }

  @Test
  void titleIsOnlySetOnce() {
    long document = indexStore.upsertDocument("http://example.com/titled");

    assertThat(indexStore.setTitleIfAbsent(document, "First")).isTrue();
    assertThat(indexStore.setTitleIfAbsent(document, "Second")).isFalse();
  }

  @Test
  void repostingOverwritesWeight() {
    long term = indexStore.upsertTerm("weight");
    long document = indexStore.upsertDocument("http://example.com/w");

    indexStore.putPostings(document, Map.of(term, 2));
    indexStore.putPostings(document, Map.of(term, 6));

    assertThat(indexStore.findPostings(term))
        .singleElement()
        .satisfies(
            hit -> {
              assertThat(hit.documentId()).isEqualTo(document);
              assertThat(hit.weight()).isEqualTo(6);
              assertThat(hit.importanceScore()).isEqualTo(Document.DEFAULT_IMPORTANCE);
            });
    assertThat(indexStore.getStatistics().postings()).isEqualTo(1);
  }

  @Test
  void linkGraphIncludesIsolatedDocumentsAndDeduplicatesEdges() {
    long a = indexStore.upsertDocument("http://example.com/a");
    long b = indexStore.upsertDocument("http://example.com/b");
    long c = indexStore.upsertDocument("http://example.com/c");
    indexStore.addLink(a, b);
    indexStore.addLink(a, b);

    Map<Long, List<Long>> graph = indexStore.getLinkGraph();

    assertThat(graph).containsOnlyKeys(a, b, c);
    assertThat(graph.get(a)).containsExactly(b);
    assertThat(graph.get(c)).isEmpty();
    assertThat(indexStore.getStatistics().links()).isEqualTo(1);
  }

  @Test
  void countsDistinctTermsPerDocument() {
    long document = indexStore.upsertDocument("http://example.com/count");
    long one = indexStore.upsertTerm("one");
    long two = indexStore.upsertTerm("two");
    indexStore.putPostings(document, Map.of(one, 0, two, 1));

    assertThat(indexStore.countTermsPerDocumentContaining(one))
        .containsExactly(Map.entry(document, 2L));
  }

  @Test
  void countsTermsOfMoreDocumentsThanAStatementCanBind() {
    long shared = indexStore.upsertTerm("shared");
    long extra = indexStore.upsertTerm("extra");
    long unrelated = indexStore.upsertTerm("unrelated");
    long other = indexStore.upsertDocument("http://example.com/other");
    indexStore.putPostings(other, Map.of(unrelated, 0));
    jdbcTemplate.update(
        "INSERT INTO documents (url) SELECT 'http://example.com/page/' || g"
            + " FROM generate_series(1, 40000) g");
    jdbcTemplate.update(
        "INSERT INTO postings (term_id, document_id, weight)"
            + " SELECT ?, id, 0 FROM documents WHERE url LIKE 'http://example.com/page/%'",
        shared);
    jdbcTemplate.update(
        "INSERT INTO postings (term_id, document_id, weight)"
            + " SELECT ?, id, 1 FROM documents WHERE url LIKE 'http://example.com/page/%'"
            + " AND id % 2 = 0",
        extra);

    Map<Long, Long> counts = indexStore.countTermsPerDocumentContaining(shared);

    assertThat(counts).hasSize(40_000).doesNotContainKey(other);
    assertThat(counts.values()).containsOnly(1L, 2L);
    assertThat(counts.values().stream().filter(count -> count == 2L).count()).isEqualTo(20_000);
  }
}
