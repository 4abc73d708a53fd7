package dev.eureka;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Eureka search engine.
 *
 * <p>Runs without a web server. With {@code eureka.crawl.seed-file} set, the application crawls
 * the seeds, recomputes PageRank and exits once the runner completes.
 */
@SpringBootApplication
public class EurekaApplication {
  public static void main(String[] args) {
    SpringApplication.run(EurekaApplication.class, args);
  }
}
