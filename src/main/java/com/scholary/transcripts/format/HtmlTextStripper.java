package com.scholary.transcripts.format;

import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Reduces an HTML transcript document to plain text.
 *
 * <p>Script and style elements are dropped with their content, {@code <br>} and the end of each
 * block element become line breaks, comments and markup disappear, entities are decoded and
 * whitespace is collapsed.
 */
public final class HtmlTextStripper {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private HtmlTextStripper() {}

  public static String strip(String html) {
    if (html == null || html.isEmpty()) {
      return "";
    }
    Document document = Jsoup.parse(html);
    document.select("script, style, noscript, template").remove();

    StringBuilder text = new StringBuilder();
    NodeTraversor.traverse(
        new NodeVisitor() {
          @Override
          public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
              text.append(textNode.getWholeText());
            } else if (node instanceof Element element && element.normalName().equals("br")) {
              text.append('\n');
            }
          }

          @Override
          public void tail(Node node, int depth) {
            if (node instanceof Element element && element.isBlock()) {
              text.append('\n');
            }
          }
        },
        document);

    return WHITESPACE.matcher(text.toString().replace('\u00A0', ' ')).replaceAll(" ").trim();
  }
}
