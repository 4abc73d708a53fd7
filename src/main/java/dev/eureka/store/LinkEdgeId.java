package dev.eureka.store;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.io.Serializable;
import java.util.Objects;

/** Composite key of a {@link LinkEdge}: the ordered (from, to) document pair. */
@Embeddable
public class LinkEdgeId implements Serializable {

  @Column(name = "from_document_id", nullable = false)
  private Long fromDocumentId;

  @Column(name = "to_document_id", nullable = false)
  private Long toDocumentId;

  protected LinkEdgeId() {
    // JPA requires no-arg constructor
  }

  public LinkEdgeId(Long fromDocumentId, Long toDocumentId) {
    this.fromDocumentId = fromDocumentId;
    this.toDocumentId = toDocumentId;
  }

  public Long getFromDocumentId() {
    return fromDocumentId;
  }

  public Long getToDocumentId() {
    return toDocumentId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LinkEdgeId other)) {
      return false;
    }
    return Objects.equals(fromDocumentId, other.fromDocumentId)
        && Objects.equals(toDocumentId, other.toDocumentId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromDocumentId, toDocumentId);
  }
}
