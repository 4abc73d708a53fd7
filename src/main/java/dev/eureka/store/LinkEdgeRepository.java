package dev.eureka.store;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for the {@link LinkEdge} graph. */
public interface LinkEdgeRepository extends JpaRepository<LinkEdge, LinkEdgeId> {

  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO links (from_document_id, to_document_id)
            VALUES (:fromId, :toId)
            ON CONFLICT DO NOTHING
            """,
      nativeQuery = true)
  int insertIfAbsent(@Param("fromId") Long fromId, @Param("toId") Long toId);

  /**
   * All edges of the graph.
   *
   * @return rows of [fromDocumentId, toDocumentId]
   */
  @Query(
      """
        SELECT l.id.fromDocumentId, l.id.toDocumentId
        FROM LinkEdge l
        ORDER BY l.id.fromDocumentId, l.id.toDocumentId
        """)
  List<Object[]> findAllEdges();
}
