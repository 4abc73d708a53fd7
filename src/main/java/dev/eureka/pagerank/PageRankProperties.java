package dev.eureka.pagerank;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * PageRank settings bound from {@code eureka.pagerank.*}.
 *
 * <ul>
 *   <li>{@code iterations} - update rounds per recomputation (default 20)
 *   <li>{@code damping} - link-following probability (default 0.85, in [0.0, 1.0])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "eureka.pagerank")
public class PageRankProperties {

  private int iterations = 20;
  private double damping = 0.85;

  @PostConstruct
  void validate() {
    if (iterations < 0) {
      throw new IllegalStateException(
          "eureka.pagerank.iterations must not be negative, got: " + iterations);
    }
    if (damping < 0.0 || damping > 1.0) {
      throw new IllegalStateException(
          "eureka.pagerank.damping must be in [0.0, 1.0], got: " + damping);
    }
  }

  public int getIterations() {
    return iterations;
  }

  public void setIterations(int iterations) {
    this.iterations = iterations;
  }

  public double getDamping() {
    return damping;
  }

  public void setDamping(double damping) {
    this.damping = damping;
  }
}
