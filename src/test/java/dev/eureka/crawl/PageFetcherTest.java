package dev.eureka.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

class PageFetcherTest {

  private MockRestServiceServer server;
  private PageFetcher pageFetcher;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder =
        RestClient.builder().defaultHeader(HttpHeaders.USER_AGENT, "eureka-test");
    server = MockRestServiceServer.bindTo(builder).build();
    pageFetcher = new PageFetcher(builder.build());
  }

  @Test
  void fetchReturnsBodyOfSuccessfulResponse() {
    server
        .expect(requestTo("http://example.com/page"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header(HttpHeaders.USER_AGENT, "eureka-test"))
        .andRespond(withSuccess("<html><body>hello</body></html>", MediaType.TEXT_HTML));

    FetchResult result = pageFetcher.fetch("http://example.com/page");

    assertThat(result.success()).isTrue();
    assertThat(result.url()).isEqualTo("http://example.com/page");
    assertThat(result.body()).isEqualTo("<html><body>hello</body></html>");
    assertThat(result.errorMessage()).isNull();
    server.verify();
  }

  @Test
  void fetchOfEmptyResponseYieldsEmptyBody() {
    server.expect(requestTo("http://example.com/empty")).andRespond(withSuccess());

    FetchResult result = pageFetcher.fetch("http://example.com/empty");

    assertThat(result.success()).isTrue();
    assertThat(result.body()).isEmpty();
  }

  @Test
  void charsetDeclaredOnlyInMetaTagIsHonoured() {
    String html =
        "<html><head><meta charset=\"ISO-8859-1\"></head><body>caf\u00e9 cr\u00e8me</body></html>";
    server
        .expect(requestTo("http://example.com/latin"))
        .andRespond(withSuccess(html.getBytes(StandardCharsets.ISO_8859_1), MediaType.TEXT_HTML));

    FetchResult result = pageFetcher.fetch("http://example.com/latin");

    assertThat(result.body()).contains("caf\u00e9 cr\u00e8me");
  }

  @Test
  void headerCharsetWinsOverDetection() {
    MediaType latin1 = new MediaType(MediaType.TEXT_HTML, StandardCharsets.ISO_8859_1);
    server
        .expect(requestTo("http://example.com/header"))
        .andRespond(withSuccess("<p>na\u00efve</p>".getBytes(StandardCharsets.ISO_8859_1), latin1));

    FetchResult result = pageFetcher.fetch("http://example.com/header");

    assertThat(result.body()).isEqualTo("<p>na\u00efve</p>");
  }

  @Test
  void undeclaredCharsetDefaultsToUtf8() {
    server
        .expect(requestTo("http://example.com/utf8"))
        .andRespond(
            withSuccess("<p>\u00fcber</p>".getBytes(StandardCharsets.UTF_8), MediaType.TEXT_HTML));

    assertThat(pageFetcher.fetch("http://example.com/utf8").body()).isEqualTo("<p>\u00fcber</p>");
  }

  @Test
  void serverErrorPropagatesForRetry() {
    server.expect(requestTo("http://example.com/broken")).andRespond(withServerError());

    assertThatThrownBy(() -> pageFetcher.fetch("http://example.com/broken"))
        .isInstanceOf(RestClientException.class);
  }

  @Test
  void notFoundPropagatesForRetry() {
    server.expect(requestTo("http://example.com/missing")).andRespond(withResourceNotFound());

    assertThatThrownBy(() -> pageFetcher.fetch("http://example.com/missing"))
        .isInstanceOf(RestClientException.class);
  }

  @Test
  void malformedUrlFailsWithoutRequest() {
    FetchResult result = pageFetcher.fetch("http://exa mple.com/");

    assertThat(result.success()).isFalse();
    assertThat(result.body()).isNull();
    assertThat(result.errorMessage()).startsWith("Malformed URL");
    server.verify();
  }

  @Test
  void recoverTurnsExhaustedRetriesIntoFailedResult() {
    FetchResult result =
        pageFetcher.recoverFetch(
            new RestClientException("Connection refused"), "http://example.com/down");

    assertThat(result.success()).isFalse();
    assertThat(result.url()).isEqualTo("http://example.com/down");
    assertThat(result.errorMessage()).isEqualTo("Connection refused");
  }
}
