package com.scholary.transcripts.service;

import com.scholary.transcripts.transcript.Transcript;

/** Thrown when operator-supplied text is below the transcript minimum length. */
public class TranscriptTooShortException extends RuntimeException {

  private final int length;

  public TranscriptTooShortException(int length) {
    super(
        String.format(
            "Transcript text must be at least %d characters, got %d",
            Transcript.MIN_LENGTH, length));
    this.length = length;
  }

  public int getLength() {
    return length;
  }
}
