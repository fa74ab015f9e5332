package com.scholary.transcripts.format;

import com.scholary.transcripts.transcript.TranscriptSegment;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Parses SubRip (.srt) subtitle files into timed segments. */
public final class SrtParser {

  private static final Pattern BLOCK_BREAK = Pattern.compile("\\r?\\n\\s*\\r?\\n");
  private static final Pattern SIGNATURE =
      Pattern.compile("^\\d+\\r?\\n\\d{2}:\\d{2}:\\d{2}[,.]\\d{3}");

  private SrtParser() {}

  /** True when the body opens with a cue index followed by an SRT timing line. */
  public static boolean looksLikeSrt(String body) {
    return body != null && SIGNATURE.matcher(VttParser.stripBom(body).trim()).find();
  }

  public static ParsedTranscript parse(String srt) {
    if (srt == null || srt.isBlank()) {
      return ParsedTranscript.empty();
    }

    List<TranscriptSegment> segments = new ArrayList<>();
    for (String block : BLOCK_BREAK.split(VttParser.stripBom(srt).trim())) {
      List<String> lines = Arrays.stream(block.split("\\r?\\n")).map(String::trim).toList();

      int timingIndex = -1;
      for (int i = 0; i < lines.size(); i++) {
        if (Cues.isTimingLine(lines.get(i))) {
          timingIndex = i;
          break;
        }
      }
      if (timingIndex < 0) {
        continue;
      }

      String text =
          String.join(
                  " ",
                  lines.subList(timingIndex + 1, lines.size()).stream()
                      .map(Cues::cleanText)
                      .filter(l -> !l.isEmpty())
                      .toList())
              .trim();
      if (text.isEmpty()) {
        continue;
      }

      Cues.Timing timing = Cues.parseTiming(lines.get(timingIndex)).orElse(null);
      segments.add(
          timing == null
              ? TranscriptSegment.untimed(text)
              : new TranscriptSegment(timing.start(), timing.duration(), text));
    }

    String fullText =
        String.join(" ", segments.stream().map(TranscriptSegment::text).toList());
    return new ParsedTranscript(fullText, segments);
  }
}
