package com.scholary.transcripts.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpFetcher} backed by the JDK HttpClient.
 *
 * <p>A single client instance is shared process-wide; each request carries its own timeout and
 * client identifier. Bodies are read through a counting loop so an oversized response is rejected
 * as soon as it crosses the limit, whether or not the server declared a Content-Length.
 */
public class JdkHttpFetcher implements HttpFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpFetcher.class);

  private static final int BUFFER_SIZE = 8192;

  private final HttpClient httpClient;

  public JdkHttpFetcher(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public HttpPayload fetch(FetchRequest request) {
    HttpResponse<InputStream> response = send(request);
    String contentType = response.headers().firstValue("Content-Type").orElse("");

    try (InputStream in = response.body()) {
      rejectDeclaredOversize(response, request);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      copyCapped(in, out, request);
      LOGGER.debug(
          "Fetched {}: status={}, contentType={}, bytes={}",
          request.uri(),
          response.statusCode(),
          contentType,
          out.size());
      return new HttpPayload(request.uri(), response.statusCode(), contentType, out.toByteArray());
    } catch (IOException e) {
      throw TranscriptFetchException.transport(describe(e, request), e);
    }
  }

  @Override
  public long download(FetchRequest request, Path target) {
    HttpResponse<InputStream> response = send(request);

    try (InputStream in = response.body()) {
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new TranscriptFetchException(
            FailureKind.TRANSPORT,
            String.format("HTTP %d for %s", response.statusCode(), request.uri()));
      }
      rejectDeclaredOversize(response, request);
      long written;
      try (OutputStream out = Files.newOutputStream(target)) {
        written = copyCapped(in, out, request);
      }
      LOGGER.debug("Downloaded {} to {}: bytes={}", request.uri(), target.getFileName(), written);
      return written;
    } catch (IOException e) {
      deleteQuietly(target);
      throw TranscriptFetchException.transport(describe(e, request), e);
    } catch (TranscriptFetchException e) {
      deleteQuietly(target);
      throw e;
    }
  }

  private HttpResponse<InputStream> send(FetchRequest request) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(request.uri())
            .timeout(request.timeout())
            .header("User-Agent", request.userAgent())
            .GET();
    if (request.accept() != null) {
      builder.header("Accept", request.accept());
    }

    try {
      return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    } catch (IOException e) {
      throw TranscriptFetchException.transport(describe(e, request), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw TranscriptFetchException.transport("Interrupted while fetching " + request.uri(), e);
    }
  }

  private static void rejectDeclaredOversize(
      HttpResponse<InputStream> response, FetchRequest request) {
    OptionalLong declared = response.headers().firstValueAsLong("Content-Length");
    if (declared.isPresent() && declared.getAsLong() > request.maxBodyBytes()) {
      throw TranscriptFetchException.tooLarge(
          String.format(
              "Response too large: %d bytes > %d byte limit for %s",
              declared.getAsLong(), request.maxBodyBytes(), request.uri()));
    }
  }

  private static long copyCapped(InputStream in, OutputStream out, FetchRequest request)
      throws IOException {
    byte[] buffer = new byte[BUFFER_SIZE];
    long total = 0;
    int read;
    while ((read = in.read(buffer)) != -1) {
      total += read;
      if (total > request.maxBodyBytes()) {
        throw TranscriptFetchException.tooLarge(
            String.format(
                "Response exceeded %d byte limit for %s", request.maxBodyBytes(), request.uri()));
      }
      out.write(buffer, 0, read);
    }
    return total;
  }

  private static String describe(IOException e, FetchRequest request) {
    URI uri = request.uri();
    if (e instanceof HttpTimeoutException) {
      return String.format("Timed out after %ds fetching %s", request.timeout().toSeconds(), uri);
    }
    if (e instanceof ConnectException) {
      return "Connection failed for " + uri;
    }
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return String.format("Fetch failed for %s: %s", uri, message);
  }

  private static void deleteQuietly(Path target) {
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      LOGGER.warn("Could not delete partial download {}: {}", target, e.getMessage());
    }
  }
}
