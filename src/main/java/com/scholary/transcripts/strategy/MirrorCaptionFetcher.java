package com.scholary.transcripts.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripts.config.AcquisitionProperties;
import com.scholary.transcripts.config.AcquisitionProperties.MirrorProperties;
import com.scholary.transcripts.format.JsonTranscriptParser;
import com.scholary.transcripts.format.ParsedTranscript;
import com.scholary.transcripts.http.FetchRequest;
import com.scholary.transcripts.http.HttpFetcher;
import com.scholary.transcripts.http.HttpPayload;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import java.net.URI;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Fetches caption tracks for content mirrored on a video platform.
 *
 * <p>Captions come from a caption service at {@code acquisition.mirror.baseUrl}:
 *
 * <pre>
 * GET {baseUrl}/transcript?videoId={id}
 *
 * {"success": true, "language": "en",
 *  "segments": [{"start": 0.0, "duration": 2.5, "text": "..."}]}
 * </pre>
 *
 * <p>A response with {@code success=false}, a 404 or an empty track means the video has no
 * captions. Any other non-2xx is a transport failure.
 */
@Component
public class MirrorCaptionFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(MirrorCaptionFetcher.class);

  private static final long MAX_RESPONSE_BYTES = 5L * 1024 * 1024;

  private final HttpFetcher httpFetcher;
  private final AcquisitionProperties properties;
  private final ObjectMapper objectMapper;
  private final JsonTranscriptParser captionParser;

  public MirrorCaptionFetcher(
      HttpFetcher httpFetcher, AcquisitionProperties properties, ObjectMapper objectMapper) {
    this.httpFetcher = httpFetcher;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.captionParser = new JsonTranscriptParser(objectMapper);
  }

  public boolean isEnabled() {
    return properties.mirror().isEnabled();
  }

  /**
   * Fetch the caption track for a mirrored video.
   *
   * @param videoId the video platform identifier
   * @return the transcript, or empty when there is no usable caption track
   * @throws com.scholary.transcripts.http.TranscriptFetchException on transport failure or an
   *     unexpected status
   * @throws IllegalStateException if no caption service is configured
   */
  public Optional<Transcript> fetchMirrorCaptions(String videoId) {
    MirrorProperties mirror = properties.mirror();
    if (!mirror.isEnabled()) {
      throw new IllegalStateException("Caption service base URL is not configured");
    }

    URI uri =
        UriComponentsBuilder.fromUriString(mirror.baseUrl())
            .path("/transcript")
            .queryParam("videoId", "{videoId}")
            .encode()
            .buildAndExpand(videoId)
            .toUri();

    HttpPayload payload =
        httpFetcher.fetch(
            new FetchRequest(
                uri,
                properties.http().userAgent(),
                "application/json",
                mirror.timeout(),
                MAX_RESPONSE_BYTES));

    if (payload.statusCode() == 404) {
      LOGGER.info("No captions for video: videoId={}", videoId);
      return Optional.empty();
    }

    String body = payload.bodyAsText();
    if (!payload.isSuccessful()) {
      if (reportsFailure(body)) {
        LOGGER.info(
            "Caption service has no track: videoId={}, status={}", videoId, payload.statusCode());
        return Optional.empty();
      }
      payload.requireSuccess();
    }

    JsonNode root = readTree(body);
    if (root == null || !root.path("success").asBoolean(true)) {
      LOGGER.info("Caption service reported no track: videoId={}", videoId);
      return Optional.empty();
    }

    ParsedTranscript parsed = captionParser.parse(body);
    if (parsed.isBlank()) {
      LOGGER.info("Caption track was empty: videoId={}", videoId);
      return Optional.empty();
    }

    String language = root.path("language").asText(null);
    Optional<Transcript> transcript =
        Transcript.from(parsed.text(), parsed.segments(), language, StrategyTag.MIRROR_CAPTION);
    if (transcript.isEmpty()) {
      LOGGER.info(
          "Caption track too short: videoId={}, length={}", videoId, parsed.text().trim().length());
    }
    return transcript;
  }

  private boolean reportsFailure(String body) {
    JsonNode root = readTree(body);
    return root != null && root.has("success") && !root.path("success").asBoolean();
  }

  private JsonNode readTree(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      return root != null && root.isObject() ? root : null;
    } catch (JsonProcessingException e) {
      LOGGER.debug("Unreadable caption service response: {}", e.getOriginalMessage());
      return null;
    }
  }
}
