package com.scholary.transcripts.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import org.junit.jupiter.api.Test;

class AcquisitionRequestTest {

  @Test
  void builder_shouldTreatBlankValuesAsAbsent() {
    AcquisitionRequest request =
        AcquisitionRequest.builder()
            .declaredTranscriptUrl("  ")
            .pageUrl(null)
            .mirrorId(" ")
            .audioUrl("")
            .build();

    assertThat(request.declaredTranscriptUrl()).isNull();
    assertThat(request.pageUrl()).isNull();
    assertThat(request.mirrorId()).isNull();
    assertThat(request.audioUrl()).isNull();
  }

  @Test
  void builder_shouldParseUrls() {
    AcquisitionRequest request =
        AcquisitionRequest.builder()
            .pageUrl(" https://example.com/ep/42 ")
            .audioUrl("https://cdn.example.com/42.mp3")
            .build();

    assertThat(request.pageUrl()).isEqualTo(URI.create("https://example.com/ep/42"));
    assertThat(request.audioUrl()).isEqualTo(URI.create("https://cdn.example.com/42.mp3"));
  }

  @Test
  void builder_shouldRejectUnparseableUrl() {
    assertThatThrownBy(() -> AcquisitionRequest.builder().audioUrl("http://bad host/ep 42.mp3"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("audioUrl");
  }

  @Test
  void constructor_shouldRejectNonHttpPageUrl() {
    assertThatThrownBy(() -> AcquisitionRequest.builder().pageUrl("file:///etc/passwd").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("pageUrl");
  }

  @Test
  void constructor_shouldRejectNegativeDuration() {
    assertThatThrownBy(() -> AcquisitionRequest.builder().audioDurationSeconds(-1.0).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
