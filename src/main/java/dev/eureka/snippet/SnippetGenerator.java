package dev.eureka.snippet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;

/**
 * Builds short result snippets that show query terms in context.
 *
 * <p>The snippet is cut around the word position with the most distinct query terms within
 * {@code contextWords} words on either side, trimmed to word boundaries with {@code ...} marking
 * cut ends, and every word starting with a query term is wrapped in {@code <b>}. Text without any
 * query term yields its beginning, truncated at a word boundary.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class SnippetGenerator {

  public static final int DEFAULT_MAX_LENGTH = 200;
  public static final int DEFAULT_CONTEXT_WORDS = 10;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String ELLIPSIS = "...";

  /** A cut end is moved to a word boundary only when one lies within this many characters. */
  private static final int BOUNDARY_SLACK = 50;

  private final int maxLength;
  private final int contextWords;

  public SnippetGenerator() {
    this(DEFAULT_MAX_LENGTH, DEFAULT_CONTEXT_WORDS);
  }

  public SnippetGenerator(int maxLength, int contextWords) {
    if (maxLength < 1) {
      throw new IllegalArgumentException("maxLength must be at least 1, got: " + maxLength);
    }
    if (contextWords < 0) {
      throw new IllegalArgumentException("contextWords must not be negative, got: " + contextWords);
    }
    this.maxLength = maxLength;
    this.contextWords = contextWords;
  }

  /**
   * Generates a snippet of plain text.
   *
   * @param text the source text; null is treated as empty
   * @param queryTerms terms to locate and highlight
   */
  public String generate(String text, List<String> queryTerms) {
    String cleaned = text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").strip();
    List<String> terms = lowerCaseTerms(queryTerms);
    if (cleaned.isEmpty() || terms.isEmpty()) {
      return truncate(cleaned);
    }

    int position = bestPosition(cleaned, terms);
    if (position < 0) {
      return truncate(cleaned);
    }
    return highlight(extractContext(cleaned, position), terms);
  }

  /** Generates a snippet from markup, using only its visible text. */
  public String fromMarkup(String html, List<String> queryTerms) {
    String text = html == null ? "" : Jsoup.parse(html).text();
    return generate(text, queryTerms);
  }

  /** Character offset of the best-scoring word, or -1 if no query term occurs. */
  private int bestPosition(String text, List<String> terms) {
    String[] words = text.toLowerCase(Locale.ROOT).split(" ");
    int bestScore = 0;
    int bestWord = -1;
    for (int i = 0; i < words.length; i++) {
      int from = Math.max(0, i - contextWords);
      int to = Math.min(words.length, i + contextWords + 1);
      int score = 0;
      for (String term : terms) {
        for (int j = from; j < to; j++) {
          if (words[j].contains(term)) {
            score++;
            break;
          }
        }
      }
      if (score > bestScore) {
        bestScore = score;
        bestWord = i;
      }
    }
    if (bestWord < 0) {
      return -1;
    }
    int offset = 0;
    for (int i = 0; i < bestWord; i++) {
      offset += words[i].length() + 1;
    }
    return offset;
  }

  private String extractContext(String text, int position) {
    int start = Math.max(0, position - maxLength / 2);
    int end = Math.min(text.length(), start + maxLength);
    if (end == text.length()) {
      start = Math.max(0, end - maxLength);
    }

    String snippet = text.substring(start, end);
    if (start > 0) {
      int firstSpace = snippet.indexOf(' ');
      if (firstSpace > 0 && firstSpace < BOUNDARY_SLACK) {
        snippet = ELLIPSIS + snippet.substring(firstSpace + 1);
      }
    }
    if (end < text.length()) {
      int lastSpace = snippet.lastIndexOf(' ');
      if (lastSpace > snippet.length() - BOUNDARY_SLACK) {
        snippet = snippet.substring(0, lastSpace) + ELLIPSIS;
      }
    }
    return snippet.strip();
  }

  private static String highlight(String snippet, List<String> terms) {
    // one alternation, longest term first, so later terms never match inside inserted tags
    List<String> ordered = new ArrayList<>(terms);
    ordered.sort(Comparator.comparingInt(String::length).reversed());
    StringBuilder alternation = new StringBuilder();
    for (String term : ordered) {
      if (alternation.length() > 0) {
        alternation.append('|');
      }
      alternation.append(Pattern.quote(term));
    }
    Pattern pattern =
        Pattern.compile(
            "\\b((?:" + alternation + ")\\w*)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    Matcher matcher = pattern.matcher(snippet);
    return matcher.replaceAll("<b>$1</b>");
  }

  private String truncate(String text) {
    if (text.length() <= maxLength) {
      return text;
    }
    String truncated = text.substring(0, maxLength);
    int lastSpace = truncated.lastIndexOf(' ');
    if (lastSpace > 0) {
      truncated = truncated.substring(0, lastSpace);
    }
    return truncated + ELLIPSIS;
  }

  private static List<String> lowerCaseTerms(List<String> queryTerms) {
    if (queryTerms == null) {
      return List.of();
    }
    return queryTerms.stream()
        .filter(term -> term != null && !term.isBlank())
        .map(term -> term.strip().toLowerCase(Locale.ROOT))
        .distinct()
        .toList();
  }
}
