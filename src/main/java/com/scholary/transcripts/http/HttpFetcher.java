package com.scholary.transcripts.http;

import java.nio.file.Path;

/**
 * Outbound HTTP used by every acquisition strategy.
 *
 * <p>Strategies depend on this interface rather than on an HTTP client so tests can substitute
 * canned responses.
 */
public interface HttpFetcher {

  /**
   * GET a resource into memory.
   *
   * <p>Non-2xx responses are returned, not thrown, so callers can read error bodies; use {@link
   * HttpPayload#requireSuccess()} when any non-2xx is a failure.
   *
   * @param request the request
   * @return the response with its body
   * @throws TranscriptFetchException on timeout, connection failure, or a body over the limit
   */
  HttpPayload fetch(FetchRequest request);

  /**
   * GET a resource and stream its body to a file.
   *
   * @param request the request
   * @param target file to write, replaced if present
   * @return number of bytes written
   * @throws TranscriptFetchException on transport failure, non-2xx, or a body over the limit
   */
  long download(FetchRequest request, Path target);
}
