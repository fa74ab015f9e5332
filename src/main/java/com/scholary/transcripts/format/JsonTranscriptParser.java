package com.scholary.transcripts.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripts.transcript.TextSegmenter;
import com.scholary.transcripts.transcript.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses JSON transcript payloads.
 *
 * <p>Accepted shapes:
 *
 * <ul>
 *   <li>an array of segment objects
 *   <li>an object with a {@code segments} array (Podcasting 2.0 JSON transcripts use this, with
 *       {@code body}, {@code startTime} and {@code endTime})
 *   <li>an object with a flat {@code transcript} or {@code text} string
 * </ul>
 *
 * <p>Anything else, including malformed JSON, yields an empty result.
 */
public class JsonTranscriptParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonTranscriptParser.class);

  private static final String[] TEXT_FIELDS = {"text", "content", "transcript", "body"};

  private final ObjectMapper objectMapper;

  public JsonTranscriptParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ParsedTranscript parse(String json) {
    if (json == null || json.isBlank()) {
      return ParsedTranscript.empty();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      LOGGER.debug("Malformed JSON transcript: {}", e.getOriginalMessage());
      return ParsedTranscript.empty();
    }

    if (root == null) {
      return ParsedTranscript.empty();
    }
    if (root.isArray()) {
      return fromSegments(root);
    }
    if (!root.isObject()) {
      return ParsedTranscript.empty();
    }

    JsonNode segments = root.get("segments");
    if (segments != null && segments.isArray()) {
      return fromSegments(segments);
    }

    JsonNode transcript = root.get("transcript");
    if (transcript != null && transcript.isArray()) {
      return fromSegments(transcript);
    }
    if (transcript != null && transcript.isTextual() && !transcript.asText().isBlank()) {
      return fromText(transcript.asText());
    }

    JsonNode text = root.get("text");
    if (text != null && text.isTextual() && !text.asText().isBlank()) {
      return fromText(text.asText());
    }

    LOGGER.debug("Unrecognized JSON transcript shape: fields={}", fieldNames(root));
    return ParsedTranscript.empty();
  }

  private ParsedTranscript fromText(String text) {
    String trimmed = text.trim();
    return new ParsedTranscript(trimmed, TextSegmenter.createSegmentsFromText(trimmed));
  }

  private ParsedTranscript fromSegments(JsonNode items) {
    List<TranscriptSegment> segments = new ArrayList<>();
    for (JsonNode item : items) {
      if (!item.isObject()) {
        continue;
      }
      String text = segmentText(item);
      if (text.isEmpty()) {
        continue;
      }
      Double start = number(item, "start", "startTime");
      Double duration = number(item, "duration");
      if (duration == null && start != null) {
        Double end = number(item, "end", "endTime");
        if (end != null) {
          duration = Math.max(0, end - start);
        }
      }
      segments.add(new TranscriptSegment(start, duration, text));
    }

    String fullText = String.join(" ", segments.stream().map(TranscriptSegment::text).toList());
    return new ParsedTranscript(fullText, segments);
  }

  private static String segmentText(JsonNode item) {
    for (String field : TEXT_FIELDS) {
      JsonNode value = item.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return value.asText().trim();
      }
    }
    return "";
  }

  private static Double number(JsonNode item, String... fields) {
    for (String field : fields) {
      JsonNode value = item.get(field);
      if (value == null || value.isNull()) {
        continue;
      }
      if (value.isNumber()) {
        return value.asDouble();
      }
      if (value.isTextual()) {
        try {
          return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
          LOGGER.debug("Ignoring non-numeric {}: {}", field, value.asText());
        }
      }
    }
    return null;
  }

  private static List<String> fieldNames(JsonNode node) {
    List<String> names = new ArrayList<>();
    node.fieldNames().forEachRemaining(names::add);
    return names;
  }
}
