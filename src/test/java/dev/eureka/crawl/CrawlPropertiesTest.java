package dev.eureka.crawl;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CrawlPropertiesTest {

  private static final CrawlProperties.Retry RETRY = new CrawlProperties.Retry(1, 500, 2.0);

  @Test
  void negativeDepthIsRejected() {
    assertThatThrownBy(() -> new CrawlProperties(-1, 3000, 3000, "ua", null, RETRY))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("max-depth");
  }

  @Test
  void nonPositiveTimeoutIsRejected() {
    assertThatThrownBy(() -> new CrawlProperties(1, 0, 3000, "ua", null, RETRY))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
