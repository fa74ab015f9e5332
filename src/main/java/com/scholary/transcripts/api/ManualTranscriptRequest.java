package com.scholary.transcripts.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Operator-entered transcript.
 *
 * @param text the transcript as plain text, HTML, WebVTT or SRT
 * @param contentType optional format hint such as {@code text/vtt}
 * @param language optional ISO language code
 */
public record ManualTranscriptRequest(
    @NotBlank @Size(max = 2_000_000) String text,
    @Size(max = 100) String contentType,
    @Size(max = 8) String language) {}
