package dev.eureka.store;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/** Directed edge of the link graph. Maps to the {@code links} table. */
@Entity
@Table(name = "links")
public class LinkEdge {

  @EmbeddedId private LinkEdgeId id;

  protected LinkEdge() {
    // JPA requires no-arg constructor
  }

  public LinkEdge(LinkEdgeId id) {
    this.id = id;
  }

  public LinkEdgeId getId() {
    return id;
  }
}
