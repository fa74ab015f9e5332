package com.scholary.transcripts.transcript;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word counting and untimed segmentation shared by every text-only source.
 *
 * <p>Keeps the segment shape consistent between scraped pages, HTML/plain feed transcripts and
 * manual text, none of which carry a time axis.
 */
public final class TextSegmenter {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE = Pattern.compile("[^.!?]+(?:[.!?]+|$)");

  private TextSegmenter() {}

  /**
   * Count whitespace-delimited tokens.
   *
   * @param text the text, may be null
   * @return number of non-empty tokens
   */
  public static int countWords(String text) {
    if (text == null) {
      return 0;
    }
    return (int) Arrays.stream(WHITESPACE.split(text.trim())).filter(t -> !t.isEmpty()).count();
  }

  /**
   * Split text into untimed segments.
   *
   * <p>Paragraphs (blank-line separated) win when there is more than one; otherwise the text is
   * split on sentence-ending punctuation. Text with neither becomes a single segment.
   */
  public static List<TranscriptSegment> createSegmentsFromText(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    List<String> paragraphs =
        Arrays.stream(PARAGRAPH_BREAK.split(text))
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .toList();

    if (paragraphs.size() > 1) {
      return paragraphs.stream().map(TranscriptSegment::untimed).toList();
    }

    List<TranscriptSegment> sentences = new ArrayList<>();
    Matcher matcher = SENTENCE.matcher(text);
    while (matcher.find()) {
      String sentence = matcher.group().trim();
      if (!sentence.isEmpty()) {
        sentences.add(TranscriptSegment.untimed(sentence));
      }
    }

    if (sentences.isEmpty()) {
      return List.of(TranscriptSegment.untimed(text.trim()));
    }
    return sentences;
  }
}
