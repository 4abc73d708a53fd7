package dev.eureka;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance, migrated by Flyway on context startup,
 * and empties every index table before each test.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanIndex() {
    jdbcTemplate.execute("TRUNCATE TABLE postings, links, terms, documents RESTART IDENTITY");
  }
}
