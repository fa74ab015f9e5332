package com.scholary.transcripts.http;

/**
 * Thrown when a strategy cannot reach or accept its source.
 *
 * <p>The orchestrator converts it into a failed attempt record; it never escapes an acquisition.
 */
public class TranscriptFetchException extends RuntimeException {

  private final FailureKind kind;

  public TranscriptFetchException(FailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public TranscriptFetchException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static TranscriptFetchException transport(String message, Throwable cause) {
    return new TranscriptFetchException(FailureKind.TRANSPORT, message, cause);
  }

  public static TranscriptFetchException tooLarge(String message) {
    return new TranscriptFetchException(FailureKind.RESOURCE_LIMIT, message);
  }

  public FailureKind getKind() {
    return kind;
  }
}
