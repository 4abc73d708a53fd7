package dev.eureka.crawl;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.Charset;
import org.jsoup.Jsoup;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
public class PageFetcher {

  private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

  private final RestClient restClient;

  public PageFetcher(@Qualifier("pageFetchRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  /**
   * Fetches the markup of a single page with an HTTP GET.
   *
   * <p>Non-2xx responses and I/O failures surface as {@link RestClientException} and are retried
   * with exponential backoff; once retries are exhausted the failure becomes an unsuccessful
   * {@link FetchResult}.
   *
   * <p>The body is decoded with the charset of the {@code Content-Type} header. Without one, the
   * byte order mark or a {@code <meta>} charset declaration decides, UTF-8 otherwise.
   */
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${eureka.crawl.retry.max-attempts:1}",
      backoff =
          @Backoff(
              delayExpression = "${eureka.crawl.retry.delay-ms:500}",
              multiplierExpression = "${eureka.crawl.retry.multiplier:2.0}"))
  public FetchResult fetch(String url) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      return FetchResult.failure(url, "Malformed URL: " + e.getMessage());
    }

    ResponseEntity<byte[]> response =
        restClient
            .get()
            .uri(uri)
            .accept(MediaType.TEXT_HTML, MediaType.ALL)
            .retrieve()
            .toEntity(byte[].class);

    byte[] body = response.getBody();
    if (body == null || body.length == 0) {
      return FetchResult.success(url, "");
    }
    MediaType contentType = response.getHeaders().getContentType();
    Charset declared = contentType == null ? null : contentType.getCharset();
    return FetchResult.success(url, new String(body, charsetOf(body, declared, url)));
  }

  private static Charset charsetOf(byte[] body, @Nullable Charset declared, String url) {
    if (declared != null) {
      return declared;
    }
    try {
      return Jsoup.parse(new ByteArrayInputStream(body), null, url).charset();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to detect charset of " + url, e);
    }
  }

  @Recover
  FetchResult recoverFetch(RestClientException e, String url) {
    log.warn("Fetch failed after retries for {}: {}", url, e.getMessage());
    return FetchResult.failure(url, e.getMessage());
  }
}
