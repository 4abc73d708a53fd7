package dev.eureka.search;

import dev.eureka.cache.CacheProperties;
import dev.eureka.cache.QueryCache;
import dev.eureka.snippet.SnippetGenerator;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the query cache and the snippet generator used by {@link SearchService}. */
@Configuration
public class SearchConfig {

  @Bean
  public QueryCache<SearchPage> searchPageCache(CacheProperties properties, Clock clock) {
    return new QueryCache<>(properties.getCapacity(), properties.getTtl(), clock);
  }

  @Bean
  public SnippetGenerator snippetGenerator() {
    return new SnippetGenerator();
  }
}
