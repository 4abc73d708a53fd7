package dev.eureka.store;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for the {@link Posting} inverted index. */
public interface PostingRepository extends JpaRepository<Posting, PostingId> {

  /** Inserts the posting, or overwrites the weight of an existing (term, document) pair. */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO postings (term_id, document_id, weight)
            VALUES (:termId, :documentId, :weight)
            ON CONFLICT (term_id, document_id) DO UPDATE SET weight = EXCLUDED.weight
            """,
      nativeQuery = true)
  int upsert(
      @Param("termId") Long termId,
      @Param("documentId") Long documentId,
      @Param("weight") int weight);

  /** Every document containing the term, in document id order, joined with document fields. */
  @Query(
      """
        SELECT new dev.eureka.store.PostingHit(d.id, d.url, d.title, d.importanceScore, p.weight)
        FROM Posting p JOIN Document d ON d.id = p.id.documentId
        WHERE p.id.termId = :termId
        ORDER BY d.id
        """)
  List<PostingHit> findHitsByTermId(@Param("termId") Long termId);

  /**
   * Number of distinct terms indexed for every document that contains the given term.
   *
   * @return rows of [documentId, count]
   */
  @Query(
      """
        SELECT other.id.documentId, COUNT(other)
        FROM Posting p JOIN Posting other ON other.id.documentId = p.id.documentId
        WHERE p.id.termId = :termId
        GROUP BY other.id.documentId
        """)
  List<Object[]> countTermsOfDocumentsContaining(@Param("termId") Long termId);
}
