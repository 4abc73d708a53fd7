package dev.eureka.ranking;

import dev.eureka.store.IndexStore;
import dev.eureka.store.PostingHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Multi-signal relevance scoring over the term index.
 *
 * <p>Each candidate document gets
 *
 * <pre>{@code
 * score = wTfidf * tf * idf + wImportance * importance
 *       + wTitle * titleMatch + wEmphasis * emphasis
 * }</pre>
 *
 * <p>with {@code idf = ln((N + 1) / (df + 1))}, {@code tf = 1 / (distinct terms in document + 1)},
 * {@code titleMatch} 1 when the lower-cased title contains the term, {@code emphasis} the posting
 * weight over the maximum emphasis weight and {@code importance} the PageRank score over the cap,
 * both clamped to [0, 1]. Results are sorted by score descending; equal scores keep document id
 * order.
 *
 * <p>All reads of one ranking run in a single read-only repeatable-read transaction, so document
 * count, postings and term counts come from the same snapshot even while a crawl is writing.
 */
@Service
public class Ranker {

  private static final Logger log = LoggerFactory.getLogger(Ranker.class);

  private final IndexStore indexStore;
  private final RankingProperties properties;
  private final TransactionTemplate readTransaction;

  public Ranker(
      IndexStore indexStore,
      RankingProperties properties,
      PlatformTransactionManager transactionManager) {
    this.indexStore = indexStore;
    this.properties = properties;
    this.readTransaction = new TransactionTemplate(transactionManager);
    this.readTransaction.setReadOnly(true);
    this.readTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
  }

  /**
   * Ranks the documents containing one term.
   *
   * @param term the query term; an unknown term yields an empty list
   * @param limit maximum number of results
   */
  public List<RankedResult> rankSingleTerm(String term, int limit) {
    requirePositive(limit);
    String normalized = normalize(term);
    return readTransaction.execute(status -> scoreSingleTerm(normalized, limit));
  }

  private List<RankedResult> scoreSingleTerm(String normalized, int limit) {
    Optional<TermPostings> postings = loadPostings(normalized, indexStore.countDocuments());
    if (postings.isEmpty()) {
      return List.of();
    }

    TermPostings termPostings = postings.get();
    Map<Long, Long> termCounts = indexStore.countTermsPerDocumentContaining(termPostings.termId());

    List<RankedResult> results = new ArrayList<>();
    for (PostingHit hit : termPostings.byDocument().values()) {
      long uniqueTerms = termCounts.getOrDefault(hit.documentId(), 0L);
      double score =
          properties.getTfidfWeight() * tf(uniqueTerms) * termPostings.idf()
              + properties.getImportanceWeight() * importance(hit.importanceScore())
              + properties.getTitleMatchWeight() * titleMatch(hit.title(), normalized)
              + properties.getEmphasisWeight() * emphasis(hit.weight());
      results.add(new RankedResult(hit.url(), hit.title(), score, hit.importanceScore()));
    }
    return sortAndLimit(results, limit);
  }

  /**
   * Ranks the documents matching several terms.
   *
   * <p>Duplicate terms count once and unknown terms are ignored. Documents containing every known
   * term are preferred; when no document contains them all, any document containing at least one
   * is a candidate. Per document the tf-idf, title and emphasis components are averaged over the
   * known terms, a term absent from the document contributing zero.
   *
   * @param terms the query terms
   * @param limit maximum number of results
   */
  public List<RankedResult> rankMultiTerm(List<String> terms, int limit) {
    requirePositive(limit);
    Set<String> distinct = new LinkedHashSet<>();
    for (String term : terms) {
      if (term != null && !term.isBlank()) {
        distinct.add(normalize(term));
      }
    }
    if (distinct.isEmpty()) {
      return List.of();
    }
    if (distinct.size() == 1) {
      return rankSingleTerm(distinct.iterator().next(), limit);
    }
    return readTransaction.execute(status -> scoreMultiTerm(distinct, limit));
  }

  private List<RankedResult> scoreMultiTerm(Set<String> distinct, int limit) {
    long documentCount = indexStore.countDocuments();
    Map<String, TermPostings> known = new LinkedHashMap<>();
    for (String term : distinct) {
      loadPostings(term, documentCount).ifPresent(postings -> known.put(term, postings));
    }
    if (known.isEmpty()) {
      log.debug("No known terms in query {}", distinct);
      return List.of();
    }

    // document id -> a posting of that document, id order for stable ties
    Map<Long, PostingHit> union = new TreeMap<>();
    known.values().forEach(postings -> postings.byDocument().forEach(union::putIfAbsent));
    Set<Long> intersection = new HashSet<>(union.keySet());
    known.values().forEach(postings -> intersection.retainAll(postings.byDocument().keySet()));

    Map<Long, PostingHit> candidates = new TreeMap<>(union);
    if (!intersection.isEmpty()) {
      candidates.keySet().retainAll(intersection);
    }

    Map<Long, Long> termCounts = new HashMap<>();
    for (TermPostings postings : known.values()) {
      indexStore
          .countTermsPerDocumentContaining(postings.termId())
          .forEach(termCounts::putIfAbsent);
    }
    int termTotal = known.size();
    List<RankedResult> results = new ArrayList<>();
    for (Map.Entry<Long, PostingHit> candidate : candidates.entrySet()) {
      PostingHit document = candidate.getValue();
      double tf = tf(termCounts.getOrDefault(candidate.getKey(), 0L));
      double tfidfSum = 0.0;
      double titleSum = 0.0;
      double emphasisSum = 0.0;
      for (Map.Entry<String, TermPostings> term : known.entrySet()) {
        PostingHit hit = term.getValue().byDocument().get(candidate.getKey());
        if (hit == null) {
          continue;
        }
        tfidfSum += tf * term.getValue().idf();
        titleSum += titleMatch(document.title(), term.getKey());
        emphasisSum += emphasis(hit.weight());
      }
      double score =
          properties.getTfidfWeight() * tfidfSum / termTotal
              + properties.getImportanceWeight() * importance(document.importanceScore())
              + properties.getTitleMatchWeight() * titleSum / termTotal
              + properties.getEmphasisWeight() * emphasisSum / termTotal;
      results.add(
          new RankedResult(document.url(), document.title(), score, document.importanceScore()));
    }
    return sortAndLimit(results, limit);
  }

  private Optional<TermPostings> loadPostings(String term, long documentCount) {
    Optional<Long> termId = indexStore.findTermId(term);
    if (termId.isEmpty()) {
      return Optional.empty();
    }
    List<PostingHit> hits = indexStore.findPostings(termId.get());
    if (hits.isEmpty()) {
      return Optional.empty();
    }
    Map<Long, PostingHit> byDocument = new TreeMap<>();
    hits.forEach(hit -> byDocument.put(hit.documentId(), hit));
    double idf = Math.log((documentCount + 1.0) / (byDocument.size() + 1.0));
    return Optional.of(new TermPostings(termId.get(), byDocument, idf));
  }

  private static double tf(long uniqueTerms) {
    return 1.0 / (uniqueTerms + 1.0);
  }

  private double importance(double importanceScore) {
    return clamp(importanceScore / properties.getImportanceCap());
  }

  private double emphasis(int weight) {
    return clamp((double) weight / properties.getMaxEmphasisWeight());
  }

  private static double titleMatch(String title, String term) {
    return title != null && title.toLowerCase(Locale.ROOT).contains(term) ? 1.0 : 0.0;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static List<RankedResult> sortAndLimit(List<RankedResult> results, int limit) {
    // List.sort is stable: equal scores keep document id order
    results.sort(Comparator.comparingDouble(RankedResult::score).reversed());
    return results.size() > limit ? List.copyOf(results.subList(0, limit)) : List.copyOf(results);
  }

  private static String normalize(String term) {
    if (term == null || term.isBlank()) {
      return "";
    }
    return term.strip().toLowerCase(Locale.ROOT);
  }

  private static void requirePositive(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1, got: " + limit);
    }
  }

  private record TermPostings(long termId, Map<Long, PostingHit> byDocument, double idf) {}
}
