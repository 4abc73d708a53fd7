package dev.eureka.ranking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for relevance scoring.
 *
 * <p>Properties are bound from {@code eureka.ranking.*} in application.yml.
 *
 * <ul>
 *   <li>{@code tfidf-weight} - weight of the tf-idf component (default 0.4)
 *   <li>{@code importance-weight} - weight of the PageRank component (default 0.3)
 *   <li>{@code title-match-weight} - weight of the title match component (default 0.2)
 *   <li>{@code emphasis-weight} - weight of the markup emphasis component (default 0.1)
 *   <li>{@code importance-cap} - PageRank score at which the importance component saturates
 *       (default 10.0)
 *   <li>{@code max-emphasis-weight} - posting weight that counts as full emphasis (default 7)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "eureka.ranking")
public class RankingProperties {

  private double tfidfWeight = 0.4;
  private double importanceWeight = 0.3;
  private double titleMatchWeight = 0.2;
  private double emphasisWeight = 0.1;
  private double importanceCap = 10.0;
  private int maxEmphasisWeight = 7;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireNonNegative("tfidf-weight", tfidfWeight);
    requireNonNegative("importance-weight", importanceWeight);
    requireNonNegative("title-match-weight", titleMatchWeight);
    requireNonNegative("emphasis-weight", emphasisWeight);
    if (importanceCap <= 0.0) {
      throw new IllegalStateException(
          "eureka.ranking.importance-cap must be positive, got: " + importanceCap);
    }
    if (maxEmphasisWeight < 1) {
      throw new IllegalStateException(
          "eureka.ranking.max-emphasis-weight must be at least 1, got: " + maxEmphasisWeight);
    }
  }

  private static void requireNonNegative(String name, double value) {
    if (value < 0.0 || Double.isNaN(value)) {
      throw new IllegalStateException(
          "eureka.ranking." + name + " must not be negative, got: " + value);
    }
  }

  public double getTfidfWeight() {
    return tfidfWeight;
  }

  public void setTfidfWeight(double tfidfWeight) {
    this.tfidfWeight = tfidfWeight;
  }

  public double getImportanceWeight() {
    return importanceWeight;
  }

  public void setImportanceWeight(double importanceWeight) {
    this.importanceWeight = importanceWeight;
  }

  public double getTitleMatchWeight() {
    return titleMatchWeight;
  }

  public void setTitleMatchWeight(double titleMatchWeight) {
    this.titleMatchWeight = titleMatchWeight;
  }

  public double getEmphasisWeight() {
    return emphasisWeight;
  }

  public void setEmphasisWeight(double emphasisWeight) {
    this.emphasisWeight = emphasisWeight;
  }

  public double getImportanceCap() {
    return importanceCap;
  }

  public void setImportanceCap(double importanceCap) {
    this.importanceCap = importanceCap;
  }

  public int getMaxEmphasisWeight() {
    return maxEmphasisWeight;
  }

  public void setMaxEmphasisWeight(int maxEmphasisWeight) {
    this.maxEmphasisWeight = maxEmphasisWeight;
  }
}
