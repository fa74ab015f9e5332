package com.scholary.transcripts.strategy;

import com.scholary.transcripts.config.AcquisitionProperties;
import com.scholary.transcripts.config.AcquisitionProperties.SpeechProperties;
import com.scholary.transcripts.http.FailureKind;
import com.scholary.transcripts.http.FetchRequest;
import com.scholary.transcripts.http.HttpFetcher;
import com.scholary.transcripts.http.TranscriptFetchException;
import com.scholary.transcripts.logging.StructuredLogger;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import com.scholary.transcripts.transcript.TranscriptSegment;
import com.scholary.transcripts.whisper.WhisperException;
import com.scholary.transcripts.whisper.WhisperProperties;
import com.scholary.transcripts.whisper.WhisperResponse;
import com.scholary.transcripts.whisper.WhisperSegment;
import com.scholary.transcripts.whisper.WhisperService;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Last-resort strategy: download the episode audio and run it through speech-to-text.
 *
 * <p>Downloads are capped in size (the transcription API rejects files over 25 MB) and episodes
 * longer than the configured ceiling are rejected before anything is downloaded. The temp file is
 * always deleted afterwards.
 */
@Component
public class SpeechToTextTranscriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechToTextTranscriber.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final HttpFetcher httpFetcher;
  private final WhisperService whisperService;
  private final WhisperProperties whisperProperties;
  private final AcquisitionProperties properties;
  private final Path tempDir;

  public SpeechToTextTranscriber(
      HttpFetcher httpFetcher,
      WhisperService whisperService,
      WhisperProperties whisperProperties,
      AcquisitionProperties properties) {
    this.httpFetcher = httpFetcher;
    this.whisperService = whisperService;
    this.whisperProperties = whisperProperties;
    this.properties = properties;
    this.tempDir = Paths.get(properties.speech().tempDir());

    try {
      Files.createDirectories(tempDir);
    } catch (IOException e) {
      throw new RuntimeException("Failed to create temp directory: " + tempDir, e);
    }
  }

  public boolean isEnabled() {
    return whisperProperties.isConfigured();
  }

  /**
   * Download and transcribe episode audio.
   *
   * @param audioUrl the enclosure URL
   * @param expectedDurationSeconds duration from the feed, null when unknown
   * @return the transcript, or empty when the recognizer returned too little text
   * @throws TranscriptFetchException when the episode is too long or too large, the download
   *     fails, or the transcription API fails
   */
  public Optional<Transcript> transcribeAudio(URI audioUrl, Double expectedDurationSeconds) {
    SpeechProperties speech = properties.speech();
    if (!AudioUrlValidator.isValid(audioUrl)) {
      throw new TranscriptFetchException(
          FailureKind.RESOURCE_LIMIT, "Not a downloadable audio URL: " + audioUrl);
    }
    if (expectedDurationSeconds != null && expectedDurationSeconds > speech.maxDurationSeconds()) {
      throw new TranscriptFetchException(
          FailureKind.RESOURCE_LIMIT,
          String.format(
              "Audio duration %.0fs exceeds %ds limit",
              expectedDurationSeconds, speech.maxDurationSeconds()));
    }

    String extension = AudioUrlValidator.fileExtension(audioUrl);
    Path audioFile = tempDir.resolve("audio_" + UUID.randomUUID() + "." + extension);
    try {
      long downloadStart = System.currentTimeMillis();
      long bytes =
          httpFetcher.download(
              new FetchRequest(
                  audioUrl,
                  properties.http().userAgent(),
                  "audio/*",
                  speech.downloadTimeout(),
                  speech.maxAudioBytes()),
              audioFile);
      structuredLogger.logAudioDownloaded(bytes, System.currentTimeMillis() - downloadStart);

      WhisperResponse response;
      try {
        response = whisperService.transcribe(audioFile, AudioUrlValidator.mimeType(audioUrl));
      } catch (WhisperException e) {
        throw TranscriptFetchException.transport("Speech-to-text failed: " + e.getMessage(), e);
      }

      String text = response.text() == null ? "" : response.text().trim();
      if (text.isEmpty()) {
        LOGGER.info("Speech-to-text returned no text: url={}", audioUrl);
        return Optional.empty();
      }

      return Transcript.from(
          text,
          toSegments(response.segments()),
          toLanguageCode(response.language()),
          StrategyTag.SPEECH_TO_TEXT);
    } finally {
      deleteQuietly(audioFile);
    }
  }

  private static List<TranscriptSegment> toSegments(List<WhisperSegment> segments) {
    return segments.stream()
        .filter(segment -> segment.text() != null && !segment.text().isBlank())
        .map(
            segment ->
                new TranscriptSegment(
                    segment.start(),
                    Math.max(0.0, segment.end() - segment.start()),
                    segment.text().trim()))
        .toList();
  }

  /** The API reports languages by English name ("english"); transcripts carry ISO codes. */
  static String toLanguageCode(String language) {
    if (language == null || language.isBlank()) {
      return null;
    }
    String trimmed = language.trim().toLowerCase(Locale.ROOT);
    if (trimmed.length() <= 3) {
      return trimmed;
    }
    return Arrays.stream(Locale.getISOLanguages())
        .filter(
            code -> new Locale(code).getDisplayLanguage(Locale.ENGLISH).equalsIgnoreCase(trimmed))
        .findFirst()
        .orElse(null);
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp audio file: {}", file, e);
    }
  }
}
