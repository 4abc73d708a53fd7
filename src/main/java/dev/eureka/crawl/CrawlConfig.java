package dev.eureka.crawl;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} the crawler fetches pages with.
 *
 * <p>Timeouts and the user agent come from {@link CrawlProperties}. The client is qualified as
 * {@code "pageFetchRestClient"}.
 */
@Configuration
@EnableConfigurationProperties(CrawlProperties.class)
public class CrawlConfig {

  /**
   * Creates the page fetching client.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties crawler timeouts and user agent
   * @return a named REST client bean for injection into {@link PageFetcher}
   */
  @Bean
  public RestClient pageFetchRestClient(RestClient.Builder builder, CrawlProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    return builder
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
        .build();
  }
}
