package com.scholary.transcripts.transcript;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical transcript produced by any acquisition strategy.
 *
 * <p>Construction enforces the invariants every consumer relies on: the text is at least {@link
 * #MIN_LENGTH} characters, the word count matches the text, and the confidence matches the
 * source. Strategies go through {@link #from} so that short text becomes a non-match instead of an
 * exception.
 */
public record Transcript(
    String fullText,
    List<TranscriptSegment> segments,
    String language,
    StrategyTag source,
    int wordCount,
    Confidence confidence) {

  /** Minimum number of characters for text to count as a transcript. */
  public static final int MIN_LENGTH = 500;

  public static final String DEFAULT_LANGUAGE = "en";

  public Transcript {
    Objects.requireNonNull(fullText, "fullText");
    Objects.requireNonNull(source, "source");
    if (fullText.isBlank() || fullText.length() < MIN_LENGTH) {
      throw new IllegalArgumentException(
          String.format(
              "Transcript text must be at least %d characters, got %d",
              MIN_LENGTH, fullText.length()));
    }
    if (wordCount != TextSegmenter.countWords(fullText)) {
      throw new IllegalArgumentException(
          String.format(
              "Word count %d does not match text (%d words)",
              wordCount, TextSegmenter.countWords(fullText)));
    }
    if (confidence != Confidence.of(source)) {
      throw new IllegalArgumentException(
          String.format("Confidence %s does not match source %s", confidence, source));
    }
    segments = segments == null ? List.of() : List.copyOf(segments);
    language = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
  }

  /**
   * Build a transcript if the text is long enough.
   *
   * @param text extracted text, trimmed before the length check
   * @param segments timed or untimed segments; when empty, untimed segments are derived from text
   * @param language ISO code, null for the default
   * @param source producing strategy
   * @return the transcript, or empty when the text is under {@link #MIN_LENGTH} characters
   */
  public static Optional<Transcript> from(
      String text, List<TranscriptSegment> segments, String language, StrategyTag source) {
    if (text == null) {
      return Optional.empty();
    }
    String fullText = text.trim();
    if (fullText.length() < MIN_LENGTH) {
      return Optional.empty();
    }
    List<TranscriptSegment> finalSegments =
        segments == null || segments.isEmpty()
            ? TextSegmenter.createSegmentsFromText(fullText)
            : segments;
    return Optional.of(
        new Transcript(
            fullText,
            finalSegments,
            language,
            source,
            TextSegmenter.countWords(fullText),
            Confidence.of(source)));
  }

  public static boolean meetsMinimumLength(String text) {
    return text != null && text.trim().length() >= MIN_LENGTH;
  }
}
