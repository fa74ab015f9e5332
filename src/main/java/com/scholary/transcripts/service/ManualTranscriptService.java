package com.scholary.transcripts.service;

import com.scholary.transcripts.format.FormatNormalizer;
import com.scholary.transcripts.format.ParsedTranscript;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns operator-entered text into a transcript.
 *
 * <p>Pasted captions (WebVTT, SRT) keep their timing; HTML and plain text are split into
 * paragraphs or sentences.
 */
@Service
public class ManualTranscriptService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManualTranscriptService.class);

  private final FormatNormalizer formatNormalizer;

  public ManualTranscriptService(FormatNormalizer formatNormalizer) {
    this.formatNormalizer = formatNormalizer;
  }

  /**
   * Normalize operator text into a {@link StrategyTag#MANUAL} transcript.
   *
   * @param text the pasted transcript
   * @param contentType format hint, null to detect from the text
   * @param language ISO code, null for the default
   * @throws TranscriptTooShortException when the normalized text is under the minimum length
   */
  public Transcript submit(String text, String contentType, String language) {
    ParsedTranscript parsed = formatNormalizer.normalize(contentType, text);
    return Transcript.from(parsed.text(), parsed.segments(), language, StrategyTag.MANUAL)
        .map(
            transcript -> {
              LOGGER.info(
                  "Accepted manual transcript: words={}, segments={}",
                  transcript.wordCount(),
                  transcript.segments().size());
              return transcript;
            })
        .orElseThrow(() -> new TranscriptTooShortException(parsed.text().trim().length()));
  }
}
