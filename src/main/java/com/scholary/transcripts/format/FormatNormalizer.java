package com.scholary.transcripts.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripts.transcript.TextSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts heterogeneous transcript payloads into text plus segments.
 *
 * <p>Pure: no I/O, no length checks. Callers decide whether the result is long enough to be a
 * transcript.
 */
@Component
public class FormatNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(FormatNormalizer.class);

  private final JsonTranscriptParser jsonParser;

  public FormatNormalizer(ObjectMapper objectMapper) {
    this.jsonParser = new JsonTranscriptParser(objectMapper);
  }

  public ParsedTranscript normalize(String contentType, String body) {
    if (body == null || body.isBlank()) {
      return ParsedTranscript.empty();
    }

    TranscriptFormat format = TranscriptFormat.detect(contentType, body);
    LOGGER.debug("Normalizing transcript payload: contentType={}, format={}", contentType, format);

    return switch (format) {
      case WEBVTT -> VttParser.parse(body);
      case JSON -> jsonParser.parse(body);
      case SRT -> SrtParser.parse(body);
      case HTML -> fromText(HtmlTextStripper.strip(body));
      case PLAIN_TEXT -> fromText(body.trim());
    };
  }

  private static ParsedTranscript fromText(String text) {
    return new ParsedTranscript(text, TextSegmenter.createSegmentsFromText(text));
  }
}
