package com.scholary.transcripts.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextSegmenterTest {

  @Test
  void countWords_shouldCountWhitespaceDelimitedTokens() {
    assertThat(TextSegmenter.countWords("  one two\tthree\n\nfour ")).isEqualTo(4);
  }

  @Test
  void countWords_shouldReturnZeroForNullOrBlank() {
    assertThat(TextSegmenter.countWords(null)).isZero();
    assertThat(TextSegmenter.countWords("   ")).isZero();
  }

  @Test
  void createSegments_shouldPreferParagraphs() {
    List<TranscriptSegment> segments =
        TextSegmenter.createSegmentsFromText(
            "First paragraph. Still first.\n\nSecond one.\n \nThird");

    assertThat(segments)
        .extracting(TranscriptSegment::text)
        .containsExactly("First paragraph. Still first.", "Second one.", "Third");
    assertThat(segments).noneMatch(TranscriptSegment::isTimed);
  }

  @Test
  void createSegments_shouldSplitSingleParagraphIntoSentences() {
    List<TranscriptSegment> segments =
        TextSegmenter.createSegmentsFromText("Hello there. How are you? Fine! And a trailing bit");

    assertThat(segments)
        .extracting(TranscriptSegment::text)
        .containsExactly("Hello there.", "How are you?", "Fine!", "And a trailing bit");
  }

  @Test
  void createSegments_shouldReturnEmptyForBlankText() {
    assertThat(TextSegmenter.createSegmentsFromText("  ")).isEmpty();
    assertThat(TextSegmenter.createSegmentsFromText(null)).isEmpty();
  }
}
