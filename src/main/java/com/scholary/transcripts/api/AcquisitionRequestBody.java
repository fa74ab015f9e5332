package com.scholary.transcripts.api;

import com.scholary.transcripts.service.AcquisitionRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request to acquire a transcript for one content item. Every hint is optional.
 *
 * @param contentId identifier echoed into logs for correlation
 * @param transcriptUrl transcript file declared by the feed
 * @param pageUrl episode or article page
 * @param mirrorId video platform identifier of a mirrored copy
 * @param audioUrl enclosure URL for speech-to-text
 * @param audioDurationSeconds duration from the feed
 */
public record AcquisitionRequestBody(
    @Size(max = 200) String contentId,
    @Schema(example = "https://example.com/episodes/42/transcript.vtt") @Size(max = 2048)
        String transcriptUrl,
    @Schema(example = "https://example.com/episodes/42") @Size(max = 2048) String pageUrl,
    @Size(max = 64) String mirrorId,
    @Schema(example = "https://cdn.example.com/episodes/42.mp3") @Size(max = 2048)
        String audioUrl,
    @PositiveOrZero Double audioDurationSeconds) {

  /**
   * @throws IllegalArgumentException if a URL does not parse
   */
  public AcquisitionRequest toRequest() {
    return AcquisitionRequest.builder()
        .contentId(contentId)
        .declaredTranscriptUrl(transcriptUrl)
        .pageUrl(pageUrl)
        .mirrorId(mirrorId)
        .audioUrl(audioUrl)
        .audioDurationSeconds(audioDurationSeconds)
        .build();
  }
}
