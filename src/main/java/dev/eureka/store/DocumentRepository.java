package dev.eureka.store;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link Document} entities. */
public interface DocumentRepository extends JpaRepository<Document, Long> {

  @Query("SELECT d.id FROM Document d WHERE d.url = :url")
  Optional<Long> findIdByUrl(@Param("url") String url);

  @Query("SELECT d.id FROM Document d ORDER BY d.id")
  List<Long> findAllIds();

  /**
   * Inserts the document unless a row with the same URL already exists.
   *
   * @param url the canonical URL
   * @return number of inserted rows (0 when the URL was already known)
   */
  @Modifying
  @Transactional
  @Query(
      value = "INSERT INTO documents (url) VALUES (:url) ON CONFLICT (url) DO NOTHING",
      nativeQuery = true)
  int insertIfAbsent(@Param("url") String url);

  /**
   * Sets the title only when none has been recorded yet.
   *
   * @return 1 if the title was written, 0 if the document already had one
   */
  @Modifying
  @Transactional
  @Query("UPDATE Document d SET d.title = :title WHERE d.id = :id AND d.title IS NULL")
  int setTitleIfAbsent(@Param("id") Long id, @Param("title") String title);

  @Modifying
  @Transactional
  @Query("UPDATE Document d SET d.importanceScore = :score WHERE d.id = :id")
  int updateImportanceScore(@Param("id") Long id, @Param("score") double score);

  /**
   * Documents containing the given term, most important first.
   *
   * @return rows of [url, title, importance_score]
   */
  @Query(
      value =
          """
            SELECT d.url, d.title, d.importance_score
            FROM documents d
            JOIN postings p ON p.document_id = d.id
            JOIN terms t ON t.id = p.term_id
            WHERE t.text = :text
            ORDER BY d.importance_score DESC, d.id ASC
            LIMIT :limit OFFSET :offset
            """,
      nativeQuery = true)
  List<Object[]> searchByTermText(
      @Param("text") String text, @Param("limit") int limit, @Param("offset") int offset);
}
