package com.scholary.transcripts.format;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.transcripts.transcript.TranscriptSegment;
import org.junit.jupiter.api.Test;

class VttParserTest {

  @Test
  void parse_shouldStripVoiceTagsAndTimingLines() {
    String vtt =
        """
        WEBVTT

        00:00:01.000 --> 00:00:03.500
        Hello <v Speaker>world</v>
        """;

    ParsedTranscript parsed = VttParser.parse(vtt);

    assertThat(parsed.text()).isEqualTo("Hello world");
    assertThat(parsed.segments()).containsExactly(new TranscriptSegment(1.0, 2.5, "Hello world"));
  }

  @Test
  void parse_shouldSkipHeaderNotesAndCueIdentifiers() {
    String vtt =
        """
        WEBVTT - Episode 42
        Kind: captions
        Language: en

        NOTE This note spans
        two lines

        intro
        00:01.000 --> 00:04.000
        First cue line
        continues here

        2
        01:00:00.250 --> 01:00:02.000 align:start
        <c.yellow>Second</c> cue &amp; more
        """;

    ParsedTranscript parsed = VttParser.parse(vtt);

    assertThat(parsed.segments())
        .extracting(TranscriptSegment::text)
        .containsExactly("First cue line continues here", "Second cue & more");
    assertThat(parsed.segments().get(0).start()).isEqualTo(1.0);
    assertThat(parsed.segments().get(0).duration()).isEqualTo(3.0);
    assertThat(parsed.segments().get(1).start()).isEqualTo(3600.25);
    assertThat(parsed.text()).isEqualTo("First cue line continues here Second cue & more");
  }

  @Test
  void parse_shouldReadCuesWhenHeaderHasNoBlankLineAfterIt() {
    String vtt =
        """
        WEBVTT
        1
        00:00:01.000 --> 00:00:03.000
        Hello <v Speaker>world</v>
        """;

    ParsedTranscript parsed = VttParser.parse(vtt);

    assertThat(parsed.text()).isEqualTo("Hello world");
    assertThat(parsed.segments()).containsExactly(new TranscriptSegment(1.0, 2.0, "Hello world"));
  }

  @Test
  void parse_shouldKeepCueLinesThatStartWithBlockKeywords() {
    String vtt =
        """
        WEBVTT

        00:00:01.000 --> 00:00:02.000
        First line
        NOTE how this keeps going
        and more

        00:00:03.000 --> 00:00:04.000
        Second
        """;

    ParsedTranscript parsed = VttParser.parse(vtt);

    assertThat(parsed.segments())
        .extracting(TranscriptSegment::text)
        .containsExactly("First line NOTE how this keeps going and more", "Second");
  }

  @Test
  void parse_shouldHandleByteOrderMarkAndCrlf() {
    String vtt = "\uFEFFWEBVTT\r\n\r\n00:00:00.000 --> 00:00:01.000\r\nOne\r\n";

    assertThat(VttParser.parse(vtt).text()).isEqualTo("One");
  }

  @Test
  void parse_shouldReturnEmptyForBlankInput() {
    assertThat(VttParser.parse("  ").isBlank()).isTrue();
    assertThat(VttParser.parse("WEBVTT\n\n").isBlank()).isTrue();
  }
}
