package com.scholary.transcripts.whisper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripts.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Client for an OpenAI-compatible {@code /v1/audio/transcriptions} endpoint.
 *
 * <p>Requests ask for {@code verbose_json} with segment timestamps. I/O errors, 429 and 5xx are
 * retried with exponential backoff and jitter up to {@code whisper.maxRetries} attempts in total.
 * Any other non-200 status fails at once, since resending a rejected file is billed again.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";
  private static final long BASE_BACKOFF_MS = 1000;

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}, configured={}",
        properties.baseUrl(),
        properties.model(),
        properties.isConfigured());
  }

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the audio file to transcribe
   * @param mimeType the audio container type
   * @return the verbose transcription response
   * @throws WhisperException if no API key is configured, the request is rejected, retries run
   *     out, or the thread is interrupted
   */
  @Override
  public WhisperResponse transcribe(Path audioFile, String mimeType) {
    if (!properties.isConfigured()) {
      throw new WhisperException("Whisper API key is not configured");
    }
    LOGGER.info("Transcribing audio: file={}, mimeType={}", audioFile.getFileName(), mimeType);

    HttpRequest request = buildRequest(audioFile, mimeType);
    int maxAttempts = properties.maxRetries();
    IOException lastFailure = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return send(request);
      } catch (IOException e) {
        lastFailure = e;
        if (attempt < maxAttempts) {
          structuredLogger.logTranscribeRetry(
              attempt, maxAttempts, e.getClass().getSimpleName(), e.getMessage());
          sleep(backoffMillis(attempt));
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", e);
      }
    }

    throw new WhisperException(
        String.format(
            "Transcription failed after %d attempts: %s", maxAttempts, lastFailure.getMessage()),
        lastFailure);
  }

  private HttpRequest buildRequest(Path audioFile, String mimeType) {
    MultipartBody body;
    try {
      body =
          new MultipartBody()
              .file("file", audioFile, mimeType)
              .field("model", properties.model())
              .field("response_format", "verbose_json")
              .field("timestamp_granularities[]", "segment");
    } catch (IOException e) {
      throw new WhisperException("Failed to read audio file: " + audioFile, e);
    }

    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrl() + TRANSCRIPTIONS_PATH))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Authorization", "Bearer " + properties.apiKey())
        .header("Content-Type", body.contentType())
        .POST(BodyPublishers.ofByteArray(body.toByteArray()))
        .build();
  }

  /**
   * Send one request.
   *
   * @throws IOException on a failure worth retrying
   */
  private WhisperResponse send(HttpRequest request) throws IOException, InterruptedException {
    LOGGER.debug("Sending transcription request to {}", request.uri());
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    int status = response.statusCode();
    if (status == 429 || status >= 500) {
      throw new IOException(
          String.format("Whisper API returned status %d: %s", status, response.body()));
    }
    if (status != 200) {
      throw new WhisperException(
          String.format(
              "Whisper API rejected request with status %d: %s", status, response.body()));
    }

    WhisperResponse parsed = parseResponse(response.body());
    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        parsed.segments().size(),
        parsed.language());
    return parsed;
  }

  WhisperResponse parseResponse(String body) {
    try {
      return objectMapper.readValue(body, WhisperResponse.class);
    } catch (JsonProcessingException e) {
      throw new WhisperException("Unreadable Whisper API response: " + e.getOriginalMessage(), e);
    }
  }

  /** 2s, 4s, 8s... plus up to a second of jitter. */
  private static long backoffMillis(int attempt) {
    return (BASE_BACKOFF_MS << attempt) + ThreadLocalRandom.current().nextLong(BASE_BACKOFF_MS);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted", e);
    }
  }
}
