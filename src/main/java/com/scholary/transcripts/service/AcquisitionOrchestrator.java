package com.scholary.transcripts.service;

import com.scholary.transcripts.http.TranscriptFetchException;
import com.scholary.transcripts.logging.StructuredLogger;
import com.scholary.transcripts.strategy.AudioUrlValidator;
import com.scholary.transcripts.strategy.FeedDeclaredTranscriptFetcher;
import com.scholary.transcripts.strategy.MirrorCaptionFetcher;
import com.scholary.transcripts.strategy.PageTranscriptScraper;
import com.scholary.transcripts.strategy.SpeechToTextTranscriber;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Acquires a transcript for one content item by trying strategies from cheapest to most
 * expensive.
 *
 * <p>Order: feed-declared transcript, page scrape, mirror captions, speech-to-text. The first
 * strategy to produce a transcript wins and the rest are not attempted. Every strategy tried or
 * skipped leaves an {@link AttemptRecord}, so an unavailable result explains itself.
 *
 * <p>Strategy failures ({@link TranscriptFetchException}) become attempt records and never escape.
 * Anything else is a bug and propagates.
 *
 * <p>Cancellation: interrupting the calling thread stops the walk at the next strategy boundary
 * with a {@link CancellationException}. An in-flight HTTP wait also ends on interrupt. An
 * interrupt during the last strategy is reported the same way instead of as "unavailable".
 */
@Service
public class AcquisitionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AcquisitionOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String NO_TRANSCRIPT_URL = "No transcript URL";
  static final String NO_PAGE_URL = "No page URL";
  static final String NO_MIRROR_ID = "No mirror identifier";
  static final String MIRROR_NOT_CONFIGURED = "Mirror captions not configured";
  static final String NO_AUDIO_URL = "No valid audio URL";
  static final String SPEECH_NOT_CONFIGURED = "Speech-to-text not configured";

  static final String EMPTY_DECLARED = "Empty transcript";
  static final String EMPTY_PAGE = "No transcript found on page";
  static final String EMPTY_CAPTIONS = "No caption track available";
  static final String EMPTY_SPEECH = "Speech-to-text produced no transcript";

  private final FeedDeclaredTranscriptFetcher feedFetcher;
  private final PageTranscriptScraper pageScraper;
  private final MirrorCaptionFetcher mirrorFetcher;
  private final SpeechToTextTranscriber speechTranscriber;

  public AcquisitionOrchestrator(
      FeedDeclaredTranscriptFetcher feedFetcher,
      PageTranscriptScraper pageScraper,
      MirrorCaptionFetcher mirrorFetcher,
      SpeechToTextTranscriber speechTranscriber) {
    this.feedFetcher = feedFetcher;
    this.pageScraper = pageScraper;
    this.mirrorFetcher = mirrorFetcher;
    this.speechTranscriber = speechTranscriber;
  }

  /**
   * Acquire a transcript.
   *
   * @param request the hints available for the content item
   * @return the transcript and the attempts made, or an unavailable result with every attempt
   * @throws CancellationException if the calling thread is interrupted between strategies or
   *     during the last one without it producing a transcript
   */
  public AcquisitionResult acquire(AcquisitionRequest request) {
    Objects.requireNonNull(request, "request");
    StructuredLogger.setContentContext(request.contentId());
    long start = System.currentTimeMillis();
    List<AttemptRecord> attempts = new ArrayList<>();

    try {
      for (StrategyTag strategy : StrategyTag.acquisitionOrder()) {
        if (Thread.currentThread().isInterrupted()) {
          throw new CancellationException(
              "Acquisition cancelled before " + strategy.wireName());
        }

        Attempt attempt = attempt(strategy, request);
        attempts.add(attempt.record());

        if (attempt.transcript().isPresent()) {
          Transcript transcript = attempt.transcript().get();
          structuredLogger.logAcquisitionSucceeded(
              transcript.source(),
              transcript.wordCount(),
              attempts.size(),
              System.currentTimeMillis() - start);
          return AcquisitionResult.succeeded(transcript, attempts);
        }
      }

      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("Acquisition cancelled after the last strategy");
      }

      structuredLogger.logAcquisitionUnavailable(
          summarize(attempts), System.currentTimeMillis() - start);
      return AcquisitionResult.unavailable(attempts);
    } finally {
      StructuredLogger.clearContentContext();
    }
  }

  private Attempt attempt(StrategyTag strategy, AcquisitionRequest request) {
    return switch (strategy) {
      case FEED_DECLARED -> {
        if (request.declaredTranscriptUrl() == null) {
          yield skip(strategy, NO_TRANSCRIPT_URL);
        }
        yield invoke(
            strategy,
            request.declaredTranscriptUrl().toString(),
            EMPTY_DECLARED,
            () -> feedFetcher.fetchDeclared(request.declaredTranscriptUrl()));
      }
      case PAGE_SCRAPED -> {
        if (request.pageUrl() == null) {
          yield skip(strategy, NO_PAGE_URL);
        }
        yield invoke(
            strategy,
            request.pageUrl().toString(),
            EMPTY_PAGE,
            () -> pageScraper.scrapePage(request.pageUrl()));
      }
      case MIRROR_CAPTION -> {
        if (request.mirrorId() == null) {
          yield skip(strategy, NO_MIRROR_ID);
        }
        if (!mirrorFetcher.isEnabled()) {
          yield skip(strategy, MIRROR_NOT_CONFIGURED);
        }
        yield invoke(
            strategy,
            request.mirrorId(),
            EMPTY_CAPTIONS,
            () -> mirrorFetcher.fetchMirrorCaptions(request.mirrorId()));
      }
      case SPEECH_TO_TEXT -> {
        if (!AudioUrlValidator.isValid(request.audioUrl())) {
          yield skip(strategy, NO_AUDIO_URL);
        }
        if (!speechTranscriber.isEnabled()) {
          yield skip(strategy, SPEECH_NOT_CONFIGURED);
        }
        yield invoke(
            strategy,
            request.audioUrl().toString(),
            EMPTY_SPEECH,
            () ->
                speechTranscriber.transcribeAudio(
                    request.audioUrl(), request.audioDurationSeconds()));
      }
      case MANUAL, UNAVAILABLE ->
          throw new IllegalStateException("Not an acquisition strategy: " + strategy);
    };
  }

  private Attempt skip(StrategyTag strategy, String reason) {
    structuredLogger.logStrategySkipped(strategy, reason);
    return new Attempt(AttemptRecord.skipped(strategy, reason), Optional.empty());
  }

  private Attempt invoke(
      StrategyTag strategy,
      String target,
      String emptyMessage,
      Supplier<Optional<Transcript>> call) {
    structuredLogger.logStrategyStarted(strategy, target);
    long start = System.currentTimeMillis();

    try {
      Optional<Transcript> transcript = call.get();
      long durationMs = System.currentTimeMillis() - start;

      if (transcript.isPresent()) {
        Transcript found = transcript.get();
        structuredLogger.logStrategySucceeded(
            strategy, found.wordCount(), found.segments().size(), durationMs);
        return new Attempt(AttemptRecord.succeeded(strategy), transcript);
      }

      structuredLogger.logStrategyFailed(
          strategy, AttemptOutcome.NO_TRANSCRIPT.wireName(), emptyMessage, durationMs);
      return new Attempt(
          AttemptRecord.failed(strategy, AttemptOutcome.NO_TRANSCRIPT, emptyMessage),
          Optional.empty());

    } catch (TranscriptFetchException e) {
      AttemptOutcome outcome = AttemptOutcome.of(e.getKind());
      String error = e.getMessage() != null ? e.getMessage() : e.getKind().name();
      structuredLogger.logStrategyFailed(
          strategy, outcome.wireName(), error, System.currentTimeMillis() - start);
      return new Attempt(AttemptRecord.failed(strategy, outcome, error), Optional.empty());
    }
  }

  private static String summarize(List<AttemptRecord> attempts) {
    return attempts.stream()
        .map(attempt -> attempt.strategy().wireName() + ": " + attempt.error())
        .collect(Collectors.joining("; "));
  }

  private record Attempt(AttemptRecord record, Optional<Transcript> transcript) {}
}
