package com.scholary.transcripts.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans text pulled out of a web page before it is judged as a transcript.
 *
 * <p>Removes social UI chrome and counters, inline timestamp markers and stray short lines, while
 * keeping paragraph breaks so untimed segments still follow the page's paragraphs.
 */
public final class TranscriptTextCleaner {

  private static final Pattern UI_CHROME_LINE =
      Pattern.compile(
          "^\\s*(share this post|subscribe( now)?|share|like|comment|comments|leave a comment)\\s*$",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
  private static final Pattern SHARE_THIS_POST =
      Pattern.compile("share this post", Pattern.CASE_INSENSITIVE);
  private static final Pattern COUNTERS =
      Pattern.compile("\\b\\d+\\s*(likes?|comments?|restacks?)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern TIMESTAMP_MARKER =
      Pattern.compile("\\[\\d{1,2}:\\d{2}(?::\\d{2})?\\]|\\(\\d{1,2}:\\d{2}(?::\\d{2})?\\)");
  private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0]+");
  private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");
  private static final Pattern DIGITS = Pattern.compile("^\\d+$");

  private TranscriptTextCleaner() {}

  public static String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }

    String cleaned = text.replace("\r\n", "\n").replace('\r', '\n');
    cleaned = UI_CHROME_LINE.matcher(cleaned).replaceAll("");
    cleaned = SHARE_THIS_POST.matcher(cleaned).replaceAll("");
    cleaned = COUNTERS.matcher(cleaned).replaceAll("");
    cleaned = TIMESTAMP_MARKER.matcher(cleaned).replaceAll("");
    cleaned = HORIZONTAL_SPACE.matcher(cleaned).replaceAll(" ");

    List<String> kept = new ArrayList<>();
    for (String line : cleaned.split("\n", -1)) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        kept.add("");
      } else if (trimmed.length() >= 3 && !DIGITS.matcher(trimmed).matches()) {
        kept.add(trimmed);
      }
    }

    cleaned = String.join("\n", kept);
    cleaned = BLANK_LINE_RUN.matcher(cleaned).replaceAll("\n\n");
    return cleaned.trim();
  }
}
