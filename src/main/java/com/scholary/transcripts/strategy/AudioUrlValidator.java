package com.scholary.transcripts.strategy;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Decides whether a URL plausibly points at downloadable audio. */
public final class AudioUrlValidator {

  private static final Map<String, String> MIME_TYPES =
      Map.ofEntries(
          Map.entry("mp3", "audio/mpeg"),
          Map.entry("m4a", "audio/mp4"),
          Map.entry("wav", "audio/wav"),
          Map.entry("ogg", "audio/ogg"),
          Map.entry("webm", "audio/webm"),
          Map.entry("mp4", "audio/mp4"),
          Map.entry("mpeg", "audio/mpeg"),
          Map.entry("mpga", "audio/mpeg"),
          Map.entry("aac", "audio/aac"),
          Map.entry("flac", "audio/flac"),
          Map.entry("opus", "audio/opus"));

  private static final String DEFAULT_EXTENSION = "mp3";

  private AudioUrlValidator() {}

  /**
   * An absolute http(s) URL with a host whose path ends in a known audio extension or mentions
   * "audio".
   */
  public static boolean isValid(URI url) {
    if (url == null || !url.isAbsolute() || url.getHost() == null) {
      return false;
    }
    String scheme = url.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      return false;
    }
    String path = path(url);
    return extension(path).isPresent() || path.contains("audio");
  }

  /** File extension for the downloaded copy; defaults to mp3 for extensionless audio paths. */
  public static String fileExtension(URI url) {
    return extension(path(url)).orElse(DEFAULT_EXTENSION);
  }

  public static String mimeType(URI url) {
    return MIME_TYPES.get(fileExtension(url));
  }

  private static String path(URI url) {
    String path = url.getPath();
    return path == null ? "" : path.toLowerCase(Locale.ROOT);
  }

  private static Optional<String> extension(String path) {
    int dot = path.lastIndexOf('.');
    if (dot < 0 || dot < path.lastIndexOf('/')) {
      return Optional.empty();
    }
    String extension = path.substring(dot + 1);
    return MIME_TYPES.containsKey(extension) ? Optional.of(extension) : Optional.empty();
  }
}
