package dev.eureka.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A crawled (or merely discovered) page identified by its canonical URL.
 *
 * <p>The title is written once, the first time a {@code <title>} element is parsed for the
 * document. {@code importanceScore} starts at 1.0 and is only overwritten by a full PageRank pass
 * via {@link IndexStore#updatePageRanks(java.util.Map)}.
 *
 * <p>Maps to the {@code documents} table managed by Flyway migrations.
 */
@Entity
@Table(name = "documents")
public class Document {

  /** Importance assigned to every document before the first PageRank run. */
  public static final double DEFAULT_IMPORTANCE = 1.0;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, updatable = false)
  private String url;

  private String title;

  @Column(name = "importance_score", nullable = false)
  private double importanceScore = DEFAULT_IMPORTANCE;

  protected Document() {
    // JPA requires no-arg constructor
  }

  public Document(String url) {
    this.url = url;
  }

  public Long getId() {
    return id;
  }

  public String getUrl() {
    return url;
  }

  public String getTitle() {
    return title;
  }

  void setTitle(String title) {
    this.title = title;
  }

  public double getImportanceScore() {
    return importanceScore;
  }
}
