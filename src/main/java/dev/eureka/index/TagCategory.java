package dev.eureka.index;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Classification of markup tags by how they affect indexing.
 *
 * <p>Each category carries the emphasis delta added to the running weight when the traversal
 * enters a tag of that category and subtracted again when it leaves. Tags without an entry are
 * {@link #NEUTRAL}. {@link #SKIPPED} tags are never entered: their whole subtree is ignored.
 */
public enum TagCategory {
  TITLE(7, "title"),
  HEADING_1(7, "h1"),
  HEADING_2(6, "h2"),
  HEADING_3(5, "h3"),
  HEADING_4(4, "h4"),
  HEADING_5(3, "h5"),
  HEADING_6(2, "h6"),
  STRONG(2, "b", "strong"),
  EMPHASIS(1, "i", "em"),
  LINK(0, "a"),
  SKIPPED(
      0,
      "meta",
      "script",
      "link",
      "embed",
      "iframe",
      "frame",
      "noscript",
      "object",
      "svg",
      "canvas",
      "applet",
      "frameset",
      "textarea",
      "style",
      "area",
      "map",
      "base",
      "basefont",
      "param"),
  NEUTRAL(0);

  private static final Map<String, TagCategory> BY_TAG = new HashMap<>();

  static {
    for (TagCategory category : values()) {
      for (String tag : category.tags) {
        BY_TAG.put(tag, category);
      }
    }
  }

  private final int weightDelta;
  private final String[] tags;

  TagCategory(int weightDelta, String... tags) {
    this.weightDelta = weightDelta;
    this.tags = tags;
  }

  /**
   * Looks up the category of a tag name, case-insensitively.
   *
   * @param tagName the element name, e.g. {@code "H2"} or {@code "strong"}
   * @return the category, {@link #NEUTRAL} for unlisted tags
   */
  public static TagCategory of(String tagName) {
    if (tagName == null) {
      return NEUTRAL;
    }
    return BY_TAG.getOrDefault(tagName.toLowerCase(Locale.ROOT), NEUTRAL);
  }

  public int weightDelta() {
    return weightDelta;
  }
}
