package dev.eureka.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A lexicon entry: a lower-cased word and the numeric identity assigned on first sighting.
 *
 * <p>Rows are written through {@link TermRepository#insertIfAbsent(String)} so that concurrent
 * writers never produce duplicates. Maps to the {@code terms} table managed by Flyway.
 */
@Entity
@Table(name = "terms")
public class Term {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, updatable = false)
  private String text;

  protected Term() {
    // JPA requires no-arg constructor
  }

  public Term(String text) {
    this.text = text;
  }

  public Long getId() {
    return id;
  }

  public String getText() {
    return text;
  }
}
