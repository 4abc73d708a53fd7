package dev.eureka.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable term index and link graph: lexicon, documents, postings and link edges.
 *
 * <p>Inserting an existing term or document returns the existing identity (upsert-or-lookup).
 * Every write is serialized behind a single lock and runs in its own transaction, so readers on
 * the serving path never observe a half-applied write. In particular {@link
 * #updatePageRanks(Map)} publishes all importance scores in one commit.
 */
@Service
public class IndexStore {

  private static final Logger log = LoggerFactory.getLogger(IndexStore.class);

  private final TermRepository termRepository;
  private final DocumentRepository documentRepository;
  private final PostingRepository postingRepository;
  private final LinkEdgeRepository linkEdgeRepository;
  private final TransactionTemplate transactionTemplate;
  private final ReentrantLock writeLock = new ReentrantLock();

  public IndexStore(
      TermRepository termRepository,
      DocumentRepository documentRepository,
      PostingRepository postingRepository,
      LinkEdgeRepository linkEdgeRepository,
      PlatformTransactionManager transactionManager) {
    this.termRepository = termRepository;
    this.documentRepository = documentRepository;
    this.postingRepository = postingRepository;
    this.linkEdgeRepository = linkEdgeRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Returns the identity of the term, assigning one on first sighting.
   *
   * @param text the word; lower-cased before lookup
   * @return the stable term id
   */
  public long upsertTerm(String text) {
    String normalized = requireText(text, "Term").toLowerCase(Locale.ROOT);
    Optional<Long> existing = termRepository.findIdByText(normalized);
    if (existing.isPresent()) {
      return existing.get();
    }
    return upsert(
        () -> termRepository.insertIfAbsent(normalized),
        () -> termRepository.findIdByText(normalized),
        "term " + normalized);
  }

  /**
   * Returns the identity of the document, assigning one on first sighting.
   *
   * @param url the canonical URL (callers canonicalize before calling)
   * @return the stable document id
   */
  public long upsertDocument(String url) {
    String canonical = requireText(url, "Document URL");
    Optional<Long> existing = documentRepository.findIdByUrl(canonical);
    if (existing.isPresent()) {
      return existing.get();
    }
    return upsert(
        () -> documentRepository.insertIfAbsent(canonical),
        () -> documentRepository.findIdByUrl(canonical),
        "document " + canonical);
  }

  /**
   * Records the document title unless one was already recorded.
   *
   * @return true if this call set the title
   */
  public boolean setTitleIfAbsent(long documentId, String title) {
    return inWriteTransaction(() -> documentRepository.setTitleIfAbsent(documentId, title)) > 0;
  }

  /** Adds the directed edge; an existing edge is left untouched. */
  public void addLink(long fromDocumentId, long toDocumentId) {
    inWriteTransaction(() -> linkEdgeRepository.insertIfAbsent(fromDocumentId, toDocumentId));
  }

  /**
   * Writes the postings of one document. Existing (term, document) pairs get the new weight.
   *
   * @param documentId the indexed document
   * @param weightsByTermId emphasis weight per term id
   */
  public void putPostings(long documentId, Map<Long, Integer> weightsByTermId) {
    if (weightsByTermId.isEmpty()) {
      return;
    }
    inWriteTransaction(
        status ->
            weightsByTermId.forEach(
                (termId, weight) -> postingRepository.upsert(termId, documentId, weight)));
    log.debug("Stored {} postings for document {}", weightsByTermId.size(), documentId);
  }

  /**
   * Overwrites the importance score of every listed document in a single transaction.
   *
   * @param scores document id to normalized PageRank score
   */
  public void updatePageRanks(Map<Long, Double> scores) {
    inWriteTransaction(
        status ->
            scores.forEach(
                (documentId, score) ->
                    documentRepository.updateImportanceScore(documentId, score)));
    log.info("Published importance scores for {} documents", scores.size());
  }

  /**
   * Documents containing the term, ordered by importance descending.
   *
   * @param term the word to look up (lower-cased)
   * @param limit maximum rows to return
   * @param offset rows to skip
   */
  public List<TermSearchHit> searchTerm(String term, int limit, int offset) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    String normalized = requireText(term, "Term").toLowerCase(Locale.ROOT);
    return documentRepository.searchByTermText(normalized, limit, offset).stream()
        .map(row -> new TermSearchHit((String) row[0], (String) row[1], toDouble(row[2])))
        .toList();
  }

  /**
   * Adjacency map of the whole link graph. Every known document is a key; documents without
   * outbound links map to an empty list.
   */
  public Map<Long, List<Long>> getLinkGraph() {
    Map<Long, List<Long>> graph = new LinkedHashMap<>();
    for (Long documentId : documentRepository.findAllIds()) {
      graph.put(documentId, new ArrayList<>());
    }
    for (Object[] edge : linkEdgeRepository.findAllEdges()) {
      Long from = toLong(edge[0]);
      Long to = toLong(edge[1]);
      graph.computeIfAbsent(from, id -> new ArrayList<>()).add(to);
    }
    return graph;
  }

  public IndexStatistics getStatistics() {
    return new IndexStatistics(
        termRepository.count(),
        documentRepository.count(),
        postingRepository.count(),
        linkEdgeRepository.count());
  }

  public Optional<Long> findTermId(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    return termRepository.findIdByText(text.toLowerCase(Locale.ROOT));
  }

  public long countDocuments() {
    return documentRepository.count();
  }

  /** Postings of the term joined with their documents, in document id order. */
  public List<PostingHit> findPostings(long termId) {
    return postingRepository.findHitsByTermId(termId);
  }

  /**
   * Number of distinct terms indexed per document, for every document containing the term.
   *
   * @param termId the term whose documents are counted
   */
  public Map<Long, Long> countTermsPerDocumentContaining(long termId) {
    Map<Long, Long> counts = new HashMap<>();
    for (Object[] row : postingRepository.countTermsOfDocumentsContaining(termId)) {
      counts.put(toLong(row[0]), toLong(row[1]));
    }
    return counts;
  }

  private long upsert(Runnable insert, Supplier<Optional<Long>> lookup, String description) {
    try {
      return inWriteTransaction(
          () -> {
            insert.run();
            return lookup.get().orElseThrow(() -> missingAfterInsert(description));
          });
    } catch (DataIntegrityViolationException e) {
      // Lost a uniqueness race against another writer: the row exists now.
      log.debug("Concurrent insert of {}, falling back to lookup", description);
      return lookup.get().orElseThrow(() -> missingAfterInsert(description));
    }
  }

  private <T> T inWriteTransaction(Supplier<T> action) {
    writeLock.lock();
    try {
      return transactionTemplate.execute(status -> action.get());
    } finally {
      writeLock.unlock();
    }
  }

  private void inWriteTransaction(Consumer<TransactionStatus> action) {
    writeLock.lock();
    try {
      transactionTemplate.executeWithoutResult(action);
    } finally {
      writeLock.unlock();
    }
  }

  private static IllegalStateException missingAfterInsert(String description) {
    return new IllegalStateException("No row found for " + description + " after insert");
  }

  private static String requireText(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return value;
  }

  private static Long toLong(Object value) {
    return ((Number) value).longValue();
  }

  private static double toDouble(Object value) {
    return ((Number) value).doubleValue();
  }
}
