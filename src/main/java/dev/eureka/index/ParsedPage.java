package dev.eureka.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Output of one {@link MarkupTraversal}: what the page says about itself.
 *
 * @param title text of the first title element, null if the page has none
 * @param hrefs raw {@code href} values of link elements in document order (unresolved)
 * @param termWeights every indexed term mapped to the emphasis weight of its last occurrence,
 *     in first-occurrence order
 */
public record ParsedPage(
    @Nullable String title, List<String> hrefs, Map<String, Integer> termWeights) {

  public ParsedPage {
    hrefs = hrefs == null ? List.of() : List.copyOf(hrefs);
    termWeights =
        termWeights == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(termWeights));
  }
}
