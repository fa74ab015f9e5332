package com.scholary.transcripts.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * What is known about one content item when acquisition starts.
 *
 * <p>Every hint is optional; a strategy whose hint is absent is skipped. The transcript and page
 * URLs must be absolute http(s) URLs when present. The audio URL only has to parse: whether it
 * points at audio is judged by the speech-to-text strategy.
 *
 * @param contentId identifier used for log correlation only, may be null
 * @param declaredTranscriptUrl transcript file declared by the feed
 * @param pageUrl episode or article web page
 * @param mirrorId identifier of the content on a video platform
 * @param audioUrl enclosure URL
 * @param audioDurationSeconds duration from the feed, null when unknown
 */
public record AcquisitionRequest(
    String contentId,
    URI declaredTranscriptUrl,
    URI pageUrl,
    String mirrorId,
    URI audioUrl,
    Double audioDurationSeconds) {

  public AcquisitionRequest {
    requireHttpUrl(declaredTranscriptUrl, "declaredTranscriptUrl");
    requireHttpUrl(pageUrl, "pageUrl");
    mirrorId = mirrorId == null || mirrorId.isBlank() ? null : mirrorId.trim();
    if (audioDurationSeconds != null
        && (audioDurationSeconds < 0 || audioDurationSeconds.isNaN())) {
      throw new IllegalArgumentException(
          "audioDurationSeconds must not be negative: " + audioDurationSeconds);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private static void requireHttpUrl(URI url, String name) {
    if (url == null) {
      return;
    }
    String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
    if (!url.isAbsolute()
        || url.getHost() == null
        || !(scheme.equals("http") || scheme.equals("https"))) {
      throw new IllegalArgumentException(name + " must be an absolute http(s) URL: " + url);
    }
  }

  /** Builds a request from raw strings; blank values count as absent. */
  public static final class Builder {

    private String contentId;
    private URI declaredTranscriptUrl;
    private URI pageUrl;
    private String mirrorId;
    private URI audioUrl;
    private Double audioDurationSeconds;

    private Builder() {}

    public Builder contentId(String contentId) {
      this.contentId = contentId;
      return this;
    }

    public Builder declaredTranscriptUrl(String url) {
      this.declaredTranscriptUrl = parse(url, "declaredTranscriptUrl");
      return this;
    }

    public Builder pageUrl(String url) {
      this.pageUrl = parse(url, "pageUrl");
      return this;
    }

    public Builder mirrorId(String mirrorId) {
      this.mirrorId = mirrorId;
      return this;
    }

    public Builder audioUrl(String url) {
      this.audioUrl = parse(url, "audioUrl");
      return this;
    }

    public Builder audioDurationSeconds(Double audioDurationSeconds) {
      this.audioDurationSeconds = audioDurationSeconds;
      return this;
    }

    public AcquisitionRequest build() {
      return new AcquisitionRequest(
          contentId, declaredTranscriptUrl, pageUrl, mirrorId, audioUrl, audioDurationSeconds);
    }

    private static URI parse(String value, String name) {
      if (value == null || value.isBlank()) {
        return null;
      }
      try {
        return new URI(value.trim());
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException(name + " is not a valid URL: " + value, e);
      }
    }
  }
}
