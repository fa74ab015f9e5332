package com.scholary.transcripts.strategy;

import com.scholary.transcripts.config.AcquisitionProperties;
import com.scholary.transcripts.format.FormatNormalizer;
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

/**
 * Fetches a transcript file the feed declares explicitly (Podcasting 2.0 {@code
 * <podcast:transcript>} and similar).
 *
 * <p>The body is normalized by detected format: WebVTT, SRT, JSON, HTML or plain text.
 */
@Component
public class FeedDeclaredTranscriptFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeedDeclaredTranscriptFetcher.class);

  static final String ACCEPT =
      "text/vtt, application/x-subrip, application/json, text/html, text/plain, */*";

  private final HttpFetcher httpFetcher;
  private final FormatNormalizer formatNormalizer;
  private final AcquisitionProperties properties;

  public FeedDeclaredTranscriptFetcher(
      HttpFetcher httpFetcher,
      FormatNormalizer formatNormalizer,
      AcquisitionProperties properties) {
    this.httpFetcher = httpFetcher;
    this.formatNormalizer = formatNormalizer;
    this.properties = properties;
  }

  /**
   * Fetch and normalize a declared transcript.
   *
   * @param transcriptUrl the URL from the feed
   * @return the transcript, or empty when the body holds too little text
   * @throws com.scholary.transcripts.http.TranscriptFetchException on non-2xx, timeout, connection
   *     failure or an oversize body
   */
  public Optional<Transcript> fetchDeclared(URI transcriptUrl) {
    FetchRequest request =
        new FetchRequest(
            transcriptUrl,
            properties.http().userAgent(),
            ACCEPT,
            properties.feed().timeout(),
            properties.feed().maxBodyBytes());

    HttpPayload payload = httpFetcher.fetch(request).requireSuccess();
    ParsedTranscript parsed =
        formatNormalizer.normalize(payload.contentType(), payload.bodyAsText());

    if (parsed.isBlank()) {
      LOGGER.info("Declared transcript had no text: url={}", transcriptUrl);
      return Optional.empty();
    }

    Optional<Transcript> transcript =
        Transcript.from(parsed.text(), parsed.segments(), null, StrategyTag.FEED_DECLARED);
    if (transcript.isEmpty()) {
      LOGGER.info(
          "Declared transcript too short: url={}, length={}",
          transcriptUrl,
          parsed.text().trim().length());
    }
    return transcript;
  }
}
