package com.scholary.transcripts.http;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * One outbound GET.
 *
 * @param uri absolute http(s) URI
 * @param userAgent client identifier sent as User-Agent
 * @param accept Accept header value, null for any
 * @param timeout bound on waiting for the response
 * @param maxBodyBytes bodies larger than this are rejected
 */
public record FetchRequest(
    URI uri, String userAgent, String accept, Duration timeout, long maxBodyBytes) {

  public FetchRequest {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(userAgent, "userAgent");
    Objects.requireNonNull(timeout, "timeout");
    if (maxBodyBytes <= 0) {
      throw new IllegalArgumentException("maxBodyBytes must be positive: " + maxBodyBytes);
    }
  }
}
