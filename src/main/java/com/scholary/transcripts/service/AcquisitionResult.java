package com.scholary.transcripts.service;

import com.scholary.transcripts.transcript.Transcript;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of an acquisition: the transcript if one was found, plus every attempt in order.
 *
 * <p>"Unavailable" is a normal result ({@code success=false}, {@code transcript=null}), not an
 * error. The null transcript is serialized explicitly.
 */
public record AcquisitionResult(
    boolean success, Transcript transcript, List<AttemptRecord> attempts) {

  public AcquisitionResult {
    Objects.requireNonNull(attempts, "attempts");
    if (success != (transcript != null)) {
      throw new IllegalArgumentException("A successful result carries exactly one transcript");
    }
    attempts = List.copyOf(attempts);
  }

  public static AcquisitionResult succeeded(Transcript transcript, List<AttemptRecord> attempts) {
    return new AcquisitionResult(true, Objects.requireNonNull(transcript), attempts);
  }

  public static AcquisitionResult unavailable(List<AttemptRecord> attempts) {
    return new AcquisitionResult(false, null, attempts);
  }
}
