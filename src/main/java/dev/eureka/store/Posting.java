package dev.eureka.store;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/**
 * Inverted index entry linking a {@link Term} to a {@link Document}.
 *
 * <p>{@code weight} is the markup emphasis the term carried in the document (heading, bold and
 * title nesting). Re-indexing the same pair overwrites the weight instead of adding a row.
 */
@Entity
@Table(name = "postings")
public class Posting {

  @EmbeddedId private PostingId id;

  @Column(nullable = false)
  private int weight;

  protected Posting() {
    // JPA requires no-arg constructor
  }

  Posting(PostingId id, int weight) {
    this.id = id;
    this.weight = weight;
  }

  public PostingId getId() {
    return id;
  }

  public int getWeight() {
    return weight;
  }
}
