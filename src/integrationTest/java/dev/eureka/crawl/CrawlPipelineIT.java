package dev.eureka.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpServer;
import dev.eureka.BaseIntegrationTest;
import dev.eureka.pagerank.PageRankService;
import dev.eureka.search.SearchPage;
import dev.eureka.search.SearchRequest;
import dev.eureka.search.SearchService;
import dev.eureka.store.IndexStore;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/** Crawls pages served by a local HTTP server and searches them through the full stack. */
class CrawlPipelineIT extends BaseIntegrationTest {

  private static final Map<String, String> PAGES =
      Map.of(
          "/",
          "<html><head><title>Unicorn Facts</title></head><body>"
              + "<h1>Unicorns</h1><p>Rainbow pastures and <b>sparkles</b>.</p>"
              + "<a href='/about'>About</a><a href='/missing'>Missing</a></body></html>",
          "/about",
          "<html><head><title>About</title></head><body>"
              + "<p>Written by unicorn enthusiasts.</p><a href='/'>Home</a></body></html>");

  private static HttpServer server;
  private static String baseUrl;

  @Autowired private CrawlService crawlService;

  @Autowired private PageRankService pageRankService;

  @Autowired private SearchService searchService;

  @Autowired private IndexStore indexStore;

  @BeforeAll
  static void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          String page = PAGES.get(exchange.getRequestURI().getPath());
          byte[] body =
              (page == null ? "not found" : page).getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "text/html; charset=UTF-8");
          exchange.sendResponseHeaders(page == null ? 404 : 200, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();
    baseUrl = "http://localhost:" + server.getAddress().getPort();
  }

  @AfterAll
  static void stopServer() {
    server.stop(0);
  }

  @BeforeEach
  void clearCache() {
    searchService.invalidateAll();
  }

  @Test
  void singlePageSeedAtDepthZeroIsIndexedAndSearchable() {
    CrawlReport report = crawlService.crawl(List.of(baseUrl + "/"), 0);

    assertThat(report.indexedUrls()).containsExactly(baseUrl + "/");
    assertThat(report.failedUrls()).isEmpty();

    pageRankService.recompute();
    SearchPage page = searchService.search(new SearchRequest("unicorn"));

    assertThat(page.hits()).extracting(hit -> hit.url()).containsExactly(baseUrl + "/");
    assertThat(page.hits().get(0).title()).isEqualTo("Unicorn Facts");
    assertThat(page.hits().get(0).snippet()).isEqualTo("<b>Unicorn</b> Facts");
  }

  @Test
  void followedLinksAreIndexedAndBrokenOnesReported() {
    CrawlReport report = crawlService.crawl(List.of(baseUrl + "/", baseUrl + "/"), 1);

    assertThat(report.indexedUrls()).containsExactly(baseUrl + "/", baseUrl + "/about");
    assertThat(report.failedUrls()).containsExactly(baseUrl + "/missing");
    assertThat(report.documentsKnown()).isEqualTo(3);
    assertThat(indexStore.getStatistics().links()).isEqualTo(3);

    pageRankService.recompute();
    SearchPage page = searchService.search(new SearchRequest("unicorn"));

    assertThat(page.totalResults()).isEqualTo(2);
    assertThat(page.hits().get(0).url()).isEqualTo(baseUrl + "/");
  }

  @Test
  void repeatedSearchIsServedFromCache() {
    crawlService.crawl(List.of(baseUrl + "/"), 0);

    SearchPage first = searchService.search(new SearchRequest("sparkles"));
    SearchPage second = searchService.search(new SearchRequest("  SPARKLES "));

    assertThat(first.cacheHit()).isFalse();
    assertThat(second.cacheHit()).isTrue();
    assertThat(second.hits()).isEqualTo(first.hits());
  }
}
