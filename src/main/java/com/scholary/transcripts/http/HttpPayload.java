package com.scholary.transcripts.http;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

/**
 * A fetched response: status, content type and the (size-capped) body.
 *
 * @param uri the requested URI
 * @param statusCode HTTP status
 * @param contentType Content-Type header, empty string when absent
 * @param body raw body bytes
 */
public record HttpPayload(URI uri, int statusCode, String contentType, byte[] body) {

  public HttpPayload {
    contentType = contentType == null ? "" : contentType;
    body = body == null ? new byte[0] : body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /**
   * Fail with a transport error unless the status is 2xx.
   *
   * @return this payload
   * @throws TranscriptFetchException for non-2xx statuses
   */
  public HttpPayload requireSuccess() {
    if (!isSuccessful()) {
      throw new TranscriptFetchException(
          FailureKind.TRANSPORT, String.format("HTTP %d for %s", statusCode, uri));
    }
    return this;
  }

  /** Decode the body with the charset named in the content type, UTF-8 otherwise. */
  public String bodyAsText() {
    return new String(body, charset());
  }

  private Charset charset() {
    for (String param : contentType.split(";")) {
      String trimmed = param.trim();
      if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
        String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
        try {
          return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
          return StandardCharsets.UTF_8;
        }
      }
    }
    return StandardCharsets.UTF_8;
  }
}
