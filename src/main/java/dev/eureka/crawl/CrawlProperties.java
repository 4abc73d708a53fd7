package dev.eureka.crawl;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Crawler settings bound from {@code eureka.crawl.*}.
 *
 * @param maxDepth link hops followed from the seeds; 0 indexes the seeds only
 * @param connectTimeoutMs TCP connection timeout per fetch
 * @param readTimeoutMs response read timeout per fetch
 * @param userAgent value of the {@code User-Agent} header sent with every fetch
 * @param seedFile path of the newline-separated seed list; the crawl command runs only when set
 * @param retry retry policy for transient fetch failures
 */
@ConfigurationProperties(prefix = "eureka.crawl")
public record CrawlProperties(
    @DefaultValue("1") int maxDepth,
    @DefaultValue("3000") int connectTimeoutMs,
    @DefaultValue("3000") int readTimeoutMs,
    @DefaultValue("eureka-crawler/1.0") String userAgent,
    @Nullable String seedFile,
    @DefaultValue Retry retry) {

  public CrawlProperties {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("eureka.crawl.max-depth must not be negative");
    }
    if (connectTimeoutMs <= 0 || readTimeoutMs <= 0) {
      throw new IllegalArgumentException("eureka.crawl timeouts must be positive");
    }
  }

  public record Retry(
      @DefaultValue("1") int maxAttempts,
      @DefaultValue("500") long delayMs,
      @DefaultValue("2.0") double multiplier) {}
}
