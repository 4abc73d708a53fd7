package dev.eureka.store;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for the {@link Term} lexicon. */
public interface TermRepository extends JpaRepository<Term, Long> {

  @Query("SELECT t.id FROM Term t WHERE t.text = :text")
  Optional<Long> findIdByText(@Param("text") String text);

  /**
   * Inserts the term unless a row with the same text already exists.
   *
   * @param text the normalized word
   * @return number of inserted rows (0 when the term was already known)
   */
  @Modifying
  @Transactional
  @Query(
      value = "INSERT INTO terms (text) VALUES (:text) ON CONFLICT (text) DO NOTHING",
      nativeQuery = true)
  int insertIfAbsent(@Param("text") String text);
}
