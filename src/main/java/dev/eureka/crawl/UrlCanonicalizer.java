package dev.eureka.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical form of crawlable URLs, so that one page maps to one document identity.
 *
 * <p>Only absolute {@code http} and {@code https} URLs with a host are accepted. Canonicalization
 * lower-cases scheme and host, drops default ports and the fragment, and turns an empty path into
 * {@code /}. Path and query are kept as they are (both are case-sensitive).
 */
public final class UrlCanonicalizer {

  private static final Logger log = LoggerFactory.getLogger(UrlCanonicalizer.class);

  /** ASCII characters browsers accept in hrefs but {@link URI} rejects. */
  private static final String UNSAFE_CHARACTERS = " \"<>\\^`{|}";

  private UrlCanonicalizer() {
    // utility class
  }

  /**
   * Canonicalizes an absolute URL.
   *
   * @param url the URL, possibly with surrounding whitespace
   * @return the canonical URL, or empty if it is malformed or not http(s)
   */
  public static Optional<String> canonicalize(String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }
    return parse(url.strip()).flatMap(UrlCanonicalizer::canonicalize);
  }

  /**
   * Resolves a link target against the URL of the page it appears on.
   *
   * @param baseUrl canonical URL of the containing page
   * @param href raw {@code href} attribute value; absolute or relative
   * @return the canonical absolute target, or empty for blank, malformed or non-http(s) targets
   */
  public static Optional<String> resolve(String baseUrl, String href) {
    if (href == null || href.isBlank()) {
      return Optional.empty();
    }
    Optional<URI> base = parse(baseUrl);
    Optional<URI> target = parse(href.strip());
    if (base.isEmpty() || target.isEmpty()) {
      return Optional.empty();
    }
    try {
      return canonicalize(base.get().resolve(target.get()));
    } catch (IllegalArgumentException e) {
      log.debug("Cannot resolve {} against {}: {}", href, baseUrl, e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<String> canonicalize(URI uri) {
    String scheme = uri.getScheme();
    String host = uri.getHost();
    if (scheme == null || host == null) {
      return Optional.empty();
    }
    scheme = scheme.toLowerCase(Locale.ROOT);
    if (!"http".equals(scheme) && !"https".equals(scheme)) {
      return Optional.empty();
    }

    String path = uri.getRawPath();
    if (path == null || path.isEmpty()) {
      path = "/";
    }
    StringBuilder sb = new StringBuilder();
    sb.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
    int port = uri.getPort();
    if (port != -1 && !isDefaultPort(scheme, port)) {
      sb.append(':').append(port);
    }
    sb.append(path);
    String query = uri.getRawQuery();
    if (query != null) {
      sb.append('?').append(query);
    }
    return Optional.of(sb.toString());
  }

  private static Optional<URI> parse(String url) {
    if (url == null) {
      return Optional.empty();
    }
    try {
      URI uri = new URI(escapeUnsafe(url));
      if (uri.isAbsolute() && uri.getRawPath() != null && uri.getRawPath().isEmpty()) {
        // java.net.URI resolves relative paths badly against an empty base path
        String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
        uri = new URI(uri.getScheme() + "://" + uri.getRawAuthority() + "/" + query);
      }
      return Optional.of(uri);
    } catch (URISyntaxException e) {
      log.debug("Malformed URL {}: {}", url, e.getMessage());
      return Optional.empty();
    }
  }

  private static String escapeUnsafe(String url) {
    StringBuilder escaped = new StringBuilder(url.length());
    for (int i = 0; i < url.length(); i++) {
      char c = url.charAt(i);
      if (c < 0x20 || c == 0x7f || UNSAFE_CHARACTERS.indexOf(c) >= 0) {
        escaped.append('%').append(String.format(Locale.ROOT, "%02X", (int) c));
      } else {
        escaped.append(c);
      }
    }
    return escaped.toString();
  }

  private static boolean isDefaultPort(String scheme, int port) {
    return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
  }
}
