package com.scholary.transcripts.logging;

import com.scholary.transcripts.transcript.StrategyTag;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Every acquisition event carries the audit fields {@code category}, {@code action} and, when
 * known, {@code contentId}, {@code strategy}, {@code durationMs} and event metadata. The fields are
 * placed in the MDC for the duration of one log call so the log pattern (or a JSON encoder) can
 * emit them as columns.
 */
public class StructuredLogger {

  public static final String CATEGORY_TRANSCRIPT = "transcript";
  public static final String CATEGORY_ASR = "asr";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a strategy being attempted. */
  public void logStrategyStarted(StrategyTag strategy, String target) {
    try {
      putEvent(CATEGORY_TRANSCRIPT, strategyAction(strategy, "start"), strategy);
      MDC.put("target", target);

      logger.info("Attempting {}: target={}", strategy.wireName(), target);
    } finally {
      clearEventFields();
    }
  }

  /** Log a strategy that produced a transcript. */
  public void logStrategySucceeded(
      StrategyTag strategy, int wordCount, int segmentCount, long durationMs) {
    try {
      putEvent(CATEGORY_TRANSCRIPT, strategyAction(strategy, "success"), strategy);
      MDC.put("wordCount", String.valueOf(wordCount));
      MDC.put("segmentCount", String.valueOf(segmentCount));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "{} acquired transcript: words={}, segments={}, duration={}ms",
          strategy.wireName(),
          wordCount,
          segmentCount,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a strategy that was attempted and failed. */
  public void logStrategyFailed(
      StrategyTag strategy, String outcome, String error, long durationMs) {
    try {
      putEvent(CATEGORY_TRANSCRIPT, strategyAction(strategy, "failed"), strategy);
      MDC.put("outcome", outcome);
      MDC.put("error", error);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.warn(
          "{} failed: outcome={}, error={}, duration={}ms",
          strategy.wireName(),
          outcome,
          error,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a strategy that was not attempted because its hint was absent. */
  public void logStrategySkipped(StrategyTag strategy, String reason) {
    try {
      putEvent(CATEGORY_TRANSCRIPT, strategyAction(strategy, "skipped"), strategy);
      MDC.put("error", reason);

      logger.debug("{} skipped: {}", strategy.wireName(), reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log the overall outcome of an acquisition that found a transcript. */
  public void logAcquisitionSucceeded(
      StrategyTag source, int wordCount, int attempts, long durationMs) {
    try {
      putEvent(CATEGORY_TRANSCRIPT, "acquisition.success", source);
      MDC.put("wordCount", String.valueOf(wordCount));
      MDC.put("attempts", String.valueOf(attempts));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Transcript acquired: source={}, words={}, attempts={}, duration={}ms",
          source.wireName(),
          wordCount,
          attempts,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the overall outcome of an acquisition that exhausted every strategy. */
  public void logAcquisitionUnavailable(String attemptSummary, long durationMs) {
    try {
      putEvent(CATEGORY_TRANSCRIPT, "acquisition.unavailable", StrategyTag.UNAVAILABLE);
      MDC.put("attempts", attemptSummary);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.warn(
          "All transcript strategies exhausted, marking unavailable: attempts=[{}], duration={}ms",
          attemptSummary,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed audio download ahead of transcription. */
  public void logAudioDownloaded(long bytes, long durationMs) {
    try {
      putEvent(CATEGORY_ASR, "download.complete", StrategyTag.SPEECH_TO_TEXT);
      MDC.put("sizeKB", String.valueOf(bytes / 1024));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Downloaded {}KB audio in {}ms", bytes / 1024, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log an ASR request retry. */
  public void logTranscribeRetry(int attempt, int maxRetries, String errorType, String message) {
    try {
      putEvent(CATEGORY_ASR, "transcribe.retry", StrategyTag.SPEECH_TO_TEXT);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("error", errorType);

      logger.warn(
          "Transcribe retry: attempt={}/{}, error={}, message={}",
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set the content item being acquired in MDC. */
  public static void setContentContext(String contentId) {
    if (contentId != null) {
      MDC.put("contentId", contentId);
    }
  }

  /** Clear content context from MDC. */
  public static void clearContentContext() {
    MDC.remove("contentId");
  }

  private static String strategyAction(StrategyTag strategy, String phase) {
    return "strategy." + strategy.wireName() + "." + phase;
  }

  private static void putEvent(String category, String action, StrategyTag strategy) {
    MDC.put("category", category);
    MDC.put("action", action);
    MDC.put("strategy", strategy.wireName());
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("category");
    MDC.remove("action");
    MDC.remove("strategy");
    MDC.remove("target");
    MDC.remove("wordCount");
    MDC.remove("segmentCount");
    MDC.remove("durationMs");
    MDC.remove("outcome");
    MDC.remove("error");
    MDC.remove("attempts");
    MDC.remove("sizeKB");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
  }
}
