package com.scholary.transcripts.format;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.parser.Parser;

/** Cue timing and cue text helpers shared by the WebVTT and SubRip parsers. */
final class Cues {

  private static final Pattern TIMING =
      Pattern.compile(
          "((?:\\d{1,2}:)?\\d{1,2}:\\d{2}[.,]\\d{1,3})\\s*-->\\s*((?:\\d{1,2}:)?\\d{1,2}:\\d{2}[.,]\\d{1,3})");
  private static final Pattern INLINE_TAG = Pattern.compile("<[^>]+>");
  private static final Pattern CUE_INDEX = Pattern.compile("^\\d+$");

  private Cues() {}

  /** Start and end of a cue, in seconds. */
  record Timing(double start, double end) {

    double duration() {
      return Math.max(0, end - start);
    }
  }

  static boolean isTimingLine(String line) {
    return line.contains("-->");
  }

  static boolean isCueIndex(String line) {
    return CUE_INDEX.matcher(line).matches();
  }

  static Optional<Timing> parseTiming(String line) {
    Matcher matcher = TIMING.matcher(line);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(new Timing(toSeconds(matcher.group(1)), toSeconds(matcher.group(2))));
  }

  /** Strip inline markup (voice, class, italics) and decode the escapes captions use. */
  static String cleanText(String line) {
    String stripped = INLINE_TAG.matcher(line).replaceAll("");
    return Parser.unescapeEntities(stripped, false).replace('\u00A0', ' ').trim();
  }

  /** Parse {@code hh:mm:ss.mmm} or {@code mm:ss.mmm}, with either '.' or ',' before millis. */
  static double toSeconds(String timestamp) {
    String[] clock = timestamp.replace(',', '.').split(":");
    double seconds = Double.parseDouble(clock[clock.length - 1]);
    int minutes = Integer.parseInt(clock[clock.length - 2]);
    int hours = clock.length == 3 ? Integer.parseInt(clock[0]) : 0;
    return hours * 3600 + minutes * 60 + seconds;
  }
}
