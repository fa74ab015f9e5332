package com.scholary.transcripts.format;

import com.scholary.transcripts.transcript.TranscriptSegment;
import java.util.List;

/**
 * Text and segments recovered from a raw transcript payload, before any length check.
 *
 * @param text the joined transcript text, empty when nothing could be recovered
 * @param segments timed cues, or untimed paragraph/sentence segments
 */
public record ParsedTranscript(String text, List<TranscriptSegment> segments) {

  public ParsedTranscript {
    text = text == null ? "" : text;
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static ParsedTranscript empty() {
    return new ParsedTranscript("", List.of());
  }

  public boolean isBlank() {
    return text.isBlank();
  }
}
