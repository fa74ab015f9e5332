package com.scholary.transcripts.strategy;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Extracts the text of an element with paragraph structure intact.
 *
 * <p>{@link Element#text()} collapses everything onto one line; here block-level elements end with
 * a blank line and {@code <br>} becomes a newline.
 */
final class BlockText {

  private BlockText() {}

  static String of(Node root) {
    StringBuilder text = new StringBuilder();
    NodeTraversor.traverse(
        new NodeVisitor() {
          @Override
          public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
              appendInline(text, textNode.text());
            } else if (node instanceof Element element && element.normalName().equals("br")) {
              text.append('\n');
            }
          }

          @Override
          public void tail(Node node, int depth) {
            if (node instanceof Element element && element.isBlock()) {
              text.append("\n\n");
            }
          }
        },
        root);
    return text.toString();
  }

  private static void appendInline(StringBuilder text, String fragment) {
    if (fragment.isBlank()) {
      if (text.length() > 0 && !Character.isWhitespace(text.charAt(text.length() - 1))) {
        text.append(' ');
      }
      return;
    }
    text.append(fragment);
  }
}
