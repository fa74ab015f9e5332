package com.scholary.transcripts.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech-to-text API client.
 *
 * <p>These control which OpenAI-compatible transcription endpoint we call and how we handle
 * timeouts/retries. A blank API key disables the speech-to-text strategy.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {

  public boolean isConfigured() {
    return apiKey != null && !apiKey.isBlank();
  }
}
