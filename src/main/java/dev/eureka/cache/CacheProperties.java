package dev.eureka.cache;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Query cache settings bound from {@code eureka.cache.*}.
 *
 * <ul>
 *   <li>{@code capacity} - maximum cached result pages (default 500)
 *   <li>{@code ttl} - lifetime of a cached page (default 30m)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "eureka.cache")
public class CacheProperties {

  private int capacity = 500;
  private Duration ttl = Duration.ofMinutes(30);

  @PostConstruct
  void validate() {
    if (capacity < 1) {
      throw new IllegalStateException(
          "eureka.cache.capacity must be at least 1, got: " + capacity);
    }
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalStateException("eureka.cache.ttl must be positive, got: " + ttl);
    }
  }

  public int getCapacity() {
    return capacity;
  }

  public void setCapacity(int capacity) {
    this.capacity = capacity;
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }
}
