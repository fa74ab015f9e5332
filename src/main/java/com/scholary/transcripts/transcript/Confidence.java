package com.scholary.transcripts.transcript;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse trust label on a transcript, driven by the strategy that produced it. */
public enum Confidence {
  HIGH,
  MEDIUM,
  LOW;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Publisher- or platform-asserted text is high; heuristic extraction and machine transcription
   * are medium.
   */
  public static Confidence of(StrategyTag source) {
    return switch (source) {
      case FEED_DECLARED, MIRROR_CAPTION, MANUAL -> HIGH;
      case PAGE_SCRAPED, SPEECH_TO_TEXT -> MEDIUM;
      case UNAVAILABLE -> LOW;
    };
  }
}
