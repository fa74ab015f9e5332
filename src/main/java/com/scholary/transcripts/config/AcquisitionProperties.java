package com.scholary.transcripts.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcript acquisition.
 *
 * <p>Timeouts are in seconds and sizes in bytes. Every outbound call made by a strategy is bounded
 * by one of these.
 */
@ConfigurationProperties(prefix = "acquisition")
@Validated
public record AcquisitionProperties(
    @Valid @NotNull HttpProperties http,
    @Valid @NotNull FeedProperties feed,
    @Valid @NotNull ScraperProperties scraper,
    @Valid @NotNull MirrorProperties mirror,
    @Valid @NotNull SpeechProperties speech,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record HttpProperties(
      @NotBlank String userAgent,
      @NotBlank String browserUserAgent,
      @Positive int connectTimeoutSeconds) {}

  public record FeedProperties(@Positive int timeoutSeconds, @Positive long maxBodyBytes) {

    public Duration timeout() {
      return Duration.ofSeconds(timeoutSeconds);
    }
  }

  public record ScraperProperties(@Positive int timeoutSeconds, @Positive long maxPageBytes) {

    public Duration timeout() {
      return Duration.ofSeconds(timeoutSeconds);
    }
  }

  /** Caption service for content mirrored on a video platform. Blank base URL disables it. */
  public record MirrorProperties(String baseUrl, @Positive int timeoutSeconds) {

    public boolean isEnabled() {
      return baseUrl != null && !baseUrl.isBlank();
    }

    public Duration timeout() {
      return Duration.ofSeconds(timeoutSeconds);
    }
  }

  public record SpeechProperties(
      @Positive int maxDurationSeconds,
      @Positive long maxAudioBytes,
      @Positive int downloadTimeoutSeconds,
      @NotBlank String tempDir) {

    public Duration downloadTimeout() {
      return Duration.ofSeconds(downloadTimeoutSeconds);
    }
  }
}
