package com.scholary.transcripts.whisper;

/**
 * Exception thrown when speech-to-text API calls fail.
 *
 * <p>This could be due to network issues, service unavailability, rejected audio, or invalid
 * responses.
 */
public class WhisperException extends RuntimeException {

  public WhisperException(String message) {
    super(message);
  }

  public WhisperException(String message, Throwable cause) {
    super(message, cause);
  }
}
