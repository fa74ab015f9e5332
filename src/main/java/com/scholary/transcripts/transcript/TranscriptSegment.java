package com.scholary.transcripts.transcript;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * A single unit of transcript text.
 *
 * <p>Timed sources (captions, VTT, ASR) fill in start and duration in seconds. Text-only sources
 * (scraped pages, articles) leave them null and produce one segment per paragraph or sentence.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptSegment(Double start, Double duration, String text) {

  public TranscriptSegment {
    Objects.requireNonNull(text, "text");
  }

  public static TranscriptSegment untimed(String text) {
    return new TranscriptSegment(null, null, text);
  }

  public boolean isTimed() {
    return start != null;
  }
}
