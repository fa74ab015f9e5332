package com.scholary.transcripts.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Verbose response from the transcription API.
 *
 * <p>Contains the full text, the detected language, the audio duration and timed segments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(
    String text, String language, Double duration, List<WhisperSegment> segments) {

  public WhisperResponse {
    segments = segments == null ? List.of() : segments;
  }
}
