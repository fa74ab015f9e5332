package com.scholary.transcripts.format;

import java.util.Locale;

/** Raw transcript payload formats, detected from the content type and the body. */
public enum TranscriptFormat {
  WEBVTT,
  JSON,
  SRT,
  HTML,
  PLAIN_TEXT;

  /**
   * Pick a format. A {@code WEBVTT} signature wins over whatever the server claims, since many
   * hosts serve captions as {@code text/plain} or {@code application/octet-stream}.
   *
   * @param contentType the Content-Type header, may be null
   * @param body the decoded body
   * @return the detected format
   */
  public static TranscriptFormat detect(String contentType, String body) {
    String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    String start = body == null ? "" : VttParser.stripBom(body).stripLeading();

    if (type.contains("text/vtt") || start.startsWith("WEBVTT")) {
      return WEBVTT;
    }
    if (type.contains("application/json") || type.contains("+json")) {
      return JSON;
    }
    if (type.contains("text/srt")
        || type.contains("application/x-subrip")
        || SrtParser.looksLikeSrt(start)) {
      return SRT;
    }
    if (type.contains("text/html") || type.contains("application/xhtml")) {
      return HTML;
    }
    return PLAIN_TEXT;
  }
}
