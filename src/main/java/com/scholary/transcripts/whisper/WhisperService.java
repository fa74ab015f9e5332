package com.scholary.transcripts.whisper;

import java.nio.file.Path;

/**
 * Interface for speech-to-text services.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the acquisition
 * strategy, and lets tests run without a paid backend.
 */
public interface WhisperService {

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the downloaded audio
   * @param mimeType the audio container type, e.g. {@code audio/mpeg}
   * @return the transcription response
   * @throws WhisperException if transcription fails
   */
  WhisperResponse transcribe(Path audioFile, String mimeType);
}
