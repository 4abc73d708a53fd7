package dev.eureka.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jspecify.annotations.Nullable;

/**
 * Depth-first walk over a parsed markup tree that extracts the title, the outbound hrefs and the
 * emphasis weight of every term.
 *
 * <p>The walk keeps a running weight. Entering a tag adds its {@link TagCategory#weightDelta()},
 * leaving subtracts it, so text always carries the sum of the deltas of its enclosing tags. A
 * term seen several times keeps the weight of its last occurrence. Subtrees under {@link
 * TagCategory#SKIPPED} tags are not visited at all.
 *
 * <p>Uses an explicit stack, so arbitrarily deep documents cannot overflow the call stack.
 */
public final class MarkupTraversal {

  private MarkupTraversal() {}

  /**
   * Parses and walks a markup document.
   *
   * @param html the raw page body; malformed markup is repaired by the parser
   * @param baseUri URL the page was fetched from, used by the parser for relative references
   */
  public static ParsedPage traverse(String html, String baseUri) {
    return traverse(Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri));
  }

  public static ParsedPage traverse(Document document) {
    return new Walk().run(document);
  }

  private static final class Frame {
    private final Node node;
    private final TagCategory category;
    private boolean childrenVisited;

    private Frame(Node node, TagCategory category) {
      this.node = node;
      this.category = category;
    }
  }

  private static final class Walk {
    private final Map<String, Integer> termWeights = new LinkedHashMap<>();
    private final List<String> hrefs = new ArrayList<>();
    private @Nullable String title;
    private int weight;

    ParsedPage run(Node root) {
      Deque<Frame> stack = new ArrayDeque<>();
      stack.push(frameFor(root));
      while (!stack.isEmpty()) {
        Frame frame = stack.peek();
        if (frame.childrenVisited) {
          stack.pop();
          weight -= frame.category.weightDelta();
          continue;
        }
        frame.childrenVisited = true;

        if (frame.node instanceof TextNode text) {
          stack.pop();
          addText(text.getWholeText());
          continue;
        }
        if (!(frame.node instanceof Element element) || frame.category == TagCategory.SKIPPED) {
          // comments, data nodes, doctype and skipped subtrees contribute nothing
          stack.pop();
          continue;
        }

        enter(element, frame.category);
        List<Node> children = element.childNodes();
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.push(frameFor(children.get(i)));
        }
      }
      return new ParsedPage(title, hrefs, termWeights);
    }

    private void enter(Element element, TagCategory category) {
      weight += category.weightDelta();
      if (category == TagCategory.TITLE && title == null) {
        String text = element.text().strip();
        if (!text.isEmpty()) {
          title = text;
        }
      } else if (category == TagCategory.LINK) {
        String href = element.attr("href").strip();
        if (!href.isEmpty()) {
          hrefs.add(href);
        }
      }
    }

    private void addText(String text) {
      for (String term : Tokenizer.tokenize(text)) {
        termWeights.put(term, weight);
      }
    }

    private static Frame frameFor(Node node) {
      TagCategory category =
          node instanceof Element element && !(node instanceof Document)
              ? TagCategory.of(element.normalName())
              : TagCategory.NEUTRAL;
      return new Frame(node, category);
    }
  }
}
