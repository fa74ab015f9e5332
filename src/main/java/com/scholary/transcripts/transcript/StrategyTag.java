package com.scholary.transcripts.transcript;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Where a transcript came from.
 *
 * <p>The set is closed: the four acquisition strategies, operator-entered text, and the terminal
 * "nothing found" marker.
 */
public enum StrategyTag {
  FEED_DECLARED("feed_declared"),
  PAGE_SCRAPED("page_scraped"),
  MIRROR_CAPTION("mirror_caption"),
  SPEECH_TO_TEXT("speech_to_text"),
  MANUAL("manual"),
  UNAVAILABLE("unavailable");

  private static final List<StrategyTag> ACQUISITION_ORDER =
      List.of(FEED_DECLARED, PAGE_SCRAPED, MIRROR_CAPTION, SPEECH_TO_TEXT);

  private final String wireName;

  StrategyTag(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * The acquisition strategies, cheapest first.
   *
   * @return feed-declared, page-scraped, mirror-caption, speech-to-text
   */
  public static List<StrategyTag> acquisitionOrder() {
    return ACQUISITION_ORDER;
  }
}
