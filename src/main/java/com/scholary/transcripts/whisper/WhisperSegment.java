package com.scholary.transcripts.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A timed segment of transcribed audio, as returned by the transcription API.
 *
 * @param start start offset in seconds
 * @param end end offset in seconds
 * @param text recognized text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperSegment(double start, double end, String text) {}
