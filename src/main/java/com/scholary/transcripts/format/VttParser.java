package com.scholary.transcripts.format;

import com.scholary.transcripts.transcript.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses WebVTT caption files into timed segments.
 *
 * <p>The header line and its metadata, NOTE/STYLE/REGION blocks, cue identifiers and timing lines
 * are skipped.
 * Every cue becomes one segment; the full text is the cue texts joined by single spaces.
 */
public final class VttParser {

  private VttParser() {}

  public static ParsedTranscript parse(String vtt) {
    if (vtt == null || vtt.isBlank()) {
      return ParsedTranscript.empty();
    }

    String[] lines = stripBom(vtt).split("\\r?\\n");
    List<TranscriptSegment> segments = new ArrayList<>();
    CueBuilder cue = null;
    boolean inHeader = false;
    boolean skippingBlock = false;

    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].trim();

      if (line.isEmpty()) {
        inHeader = false;
        skippingBlock = false;
        cue = flush(cue, segments);
        continue;
      }
      if (i == 0 && line.startsWith("WEBVTT")) {
        inHeader = true;
        continue;
      }
      if (inHeader) {
        // Header metadata ends at a blank line or at the first timing line
        if (!Cues.isTimingLine(line)) {
          continue;
        }
        inHeader = false;
      }
      if (skippingBlock) {
        continue;
      }
      if (cue == null && isBlockStart(line)) {
        skippingBlock = true;
        continue;
      }
      if (Cues.isTimingLine(line)) {
        cue = flush(cue, segments);
        cue = new CueBuilder(Cues.parseTiming(line).orElse(null));
        continue;
      }
      if (cue == null && isCueIdentifier(line, lines, i)) {
        continue;
      }

      String text = Cues.cleanText(line);
      if (text.isEmpty()) {
        continue;
      }
      if (cue == null) {
        cue = new CueBuilder(null);
      }
      cue.append(text);
    }
    flush(cue, segments);

    String fullText =
        String.join(" ", segments.stream().map(TranscriptSegment::text).toList());
    return new ParsedTranscript(fullText, segments);
  }

  /** NOTE, STYLE and REGION blocks run until the next blank line. */
  private static boolean isBlockStart(String line) {
    return line.equals("NOTE")
        || line.startsWith("NOTE ")
        || line.equals("STYLE")
        || line.equals("REGION");
  }

  private static boolean isCueIdentifier(String line, String[] lines, int index) {
    if (Cues.isCueIndex(line)) {
      return true;
    }
    return index + 1 < lines.length && Cues.isTimingLine(lines[index + 1]);
  }

  private static CueBuilder flush(CueBuilder cue, List<TranscriptSegment> segments) {
    if (cue != null && cue.hasText()) {
      segments.add(cue.build());
    }
    return null;
  }

  static String stripBom(String text) {
    return text.startsWith("\uFEFF") ? text.substring(1) : text;
  }

  /** Accumulates the text lines of one cue. */
  static final class CueBuilder {
    private final Cues.Timing timing;
    private final StringBuilder text = new StringBuilder();

    CueBuilder(Cues.Timing timing) {
      this.timing = timing;
    }

    void append(String line) {
      if (text.length() > 0) {
        text.append(' ');
      }
      text.append(line);
    }

    boolean hasText() {
      return text.length() > 0;
    }

    TranscriptSegment build() {
      if (timing == null) {
        return TranscriptSegment.untimed(text.toString());
      }
      return new TranscriptSegment(timing.start(), timing.duration(), text.toString());
    }
  }
}
