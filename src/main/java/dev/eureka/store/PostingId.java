package dev.eureka.store;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.io.Serializable;
import java.util.Objects;

/** Composite key of a {@link Posting}: one row per (term, document) pair. */
@Embeddable
public class PostingId implements Serializable {

  @Column(name = "term_id", nullable = false)
  private Long termId;

  @Column(name = "document_id", nullable = false)
  private Long documentId;

  protected PostingId() {
    // JPA requires no-arg constructor
  }

  public PostingId(Long termId, Long documentId) {
    this.termId = termId;
    this.documentId = documentId;
  }

  public Long getTermId() {
    return termId;
  }

  public Long getDocumentId() {
    return documentId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PostingId other)) {
      return false;
    }
    return Objects.equals(termId, other.termId) && Objects.equals(documentId, other.documentId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(termId, documentId);
  }
}
