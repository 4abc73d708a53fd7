package dev.eureka.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits text into index terms.
 *
 * <p>Text is lower-cased and split on every run of characters other than ASCII letters, digits,
 * hyphen and underscore. Empty tokens and stopwords are dropped. Query strings go through the same
 * rules so that query terms line up with indexed terms.
 */
public final class Tokenizer {

  private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9_\\-]+");

  /** Common words and every single letter. */
  static final Set<String> STOPWORDS =
      Set.of(
          "the", "of", "at", "on", "in", "is", "it", "and", "or", "a", "b", "c", "d", "e", "f",
          "g", "h", "i", "j", "k", "l", "m", "n", "o", "p", "q", "r", "s", "t", "u", "v", "w",
          "x", "y", "z");

  private Tokenizer() {}

  /**
   * Tokenizes the text, keeping duplicates and order.
   *
   * @param text raw text, may be null
   * @return lower-cased terms without stopwords
   */
  public static List<String> tokenize(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<String> terms = new ArrayList<>();
    for (String token : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty() && !STOPWORDS.contains(token)) {
        terms.add(token);
      }
    }
    return terms;
  }
}
