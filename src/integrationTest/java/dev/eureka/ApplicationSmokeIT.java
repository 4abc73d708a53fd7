package dev.eureka;

import static org.assertj.core.api.Assertions.assertThat;

import dev.eureka.cli.CrawlCommandRunner;
import dev.eureka.search.SearchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;

class ApplicationSmokeIT extends BaseIntegrationTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoadsWithFlywaySchema() {
    assertThat(context.getBean(SearchService.class)).isNotNull();
    Integer tables =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM information_schema.tables WHERE table_name IN "
                + "('terms', 'documents', 'postings', 'links')",
            Integer.class);
    assertThat(tables).isEqualTo(4);
  }

  @Test
  void crawlRunnerIsInactiveWithoutSeedFile() {
    assertThat(context.getBeanNamesForType(CrawlCommandRunner.class)).isEmpty();
  }
}
