package dev.eureka.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the serving path.
 *
 * <p>Properties are bound from {@code eureka.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-results} - ranked results considered per query before pagination (default
 *       1000, bounded [1, 100000])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "eureka.search")
public class SearchProperties {

  private int maxResults = 1000;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxResults < 1 || maxResults > 100_000) {
      throw new IllegalStateException(
          "eureka.search.max-results must be in [1, 100000], got: " + maxResults);
    }
  }

  public int getMaxResults() {
    return maxResults;
  }

  public void setMaxResults(int maxResults) {
    this.maxResults = maxResults;
  }
}
