package com.scholary.transcripts.service;

import com.fasterxml.jackson.annotation.JsonValue;
import com.scholary.transcripts.http.FailureKind;
import java.util.Locale;

/** How a single strategy attempt ended. */
public enum AttemptOutcome {
  SUCCEEDED,

  /** Not attempted: the request carried no hint for this strategy, or it is not configured. */
  SKIPPED,

  TRANSPORT_FAILURE,

  /** Fetched, but nothing usable as a transcript. */
  NO_TRANSCRIPT,

  /** Refused before the expensive work: too large, too long, or not an audio URL. */
  REJECTED;

  public static AttemptOutcome of(FailureKind kind) {
    return switch (kind) {
      case TRANSPORT -> TRANSPORT_FAILURE;
      case CONTENT_SHAPE -> NO_TRANSCRIPT;
      case RESOURCE_LIMIT -> REJECTED;
    };
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
