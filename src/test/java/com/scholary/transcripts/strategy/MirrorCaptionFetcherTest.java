package com.scholary.transcripts.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripts.TestFixtures;
import com.scholary.transcripts.http.FetchRequest;
import com.scholary.transcripts.http.HttpFetcher;
import com.scholary.transcripts.http.HttpPayload;
import com.scholary.transcripts.http.TranscriptFetchException;
import com.scholary.transcripts.transcript.Confidence;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import com.scholary.transcripts.transcript.TranscriptSegment;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MirrorCaptionFetcherTest {

  private static final String BASE_URL = "http://captions.local:3000";

  @Mock private HttpFetcher httpFetcher;

  @TempDir Path tempDir;

  private MirrorCaptionFetcher fetcher;

  @BeforeEach
  void setUp() {
    fetcher =
        new MirrorCaptionFetcher(
            httpFetcher, TestFixtures.properties(BASE_URL, tempDir), new ObjectMapper());
  }

  @Test
  void fetchMirrorCaptions_shouldBuildTimedTranscript() {
    givenResponse(200, captionJson("segments", 10, "\"language\":\"fr\","));

    Transcript transcript = fetcher.fetchMirrorCaptions("dQw4w9WgXcQ").orElseThrow();

    assertThat(transcript.source()).isEqualTo(StrategyTag.MIRROR_CAPTION);
    assertThat(transcript.confidence()).isEqualTo(Confidence.HIGH);
    assertThat(transcript.language()).isEqualTo("fr");
    assertThat(transcript.segments()).hasSize(10).allMatch(TranscriptSegment::isTimed);
    assertThat(transcript.segments().get(3).start()).isEqualTo(9.0);
    assertThat(transcript.segments().get(3).duration()).isEqualTo(3.0);
  }

  @Test
  void fetchMirrorCaptions_shouldQueryByVideoId() {
    givenResponse(200, captionJson("transcript", 10, ""));

    fetcher.fetchMirrorCaptions("abc 123");

    ArgumentCaptor<FetchRequest> captor = ArgumentCaptor.forClass(FetchRequest.class);
    verify(httpFetcher).fetch(captor.capture());
    assertThat(captor.getValue().uri())
        .isEqualTo(URI.create(BASE_URL + "/transcript?videoId=abc%20123"));
  }

  @Test
  void fetchMirrorCaptions_shouldEncodeReservedCharactersInVideoId() {
    givenResponse(200, captionJson("transcript", 10, ""));

    fetcher.fetchMirrorCaptions("ab{c}d&x=1");

    ArgumentCaptor<FetchRequest> captor = ArgumentCaptor.forClass(FetchRequest.class);
    verify(httpFetcher).fetch(captor.capture());
    assertThat(captor.getValue().uri())
        .isEqualTo(URI.create(BASE_URL + "/transcript?videoId=ab%7Bc%7Dd%26x%3D1"));
  }

  @Test
  void fetchMirrorCaptions_shouldAcceptTranscriptArray() {
    givenResponse(200, captionJson("transcript", 10, ""));

    assertThat(fetcher.fetchMirrorCaptions("abc")).isPresent();
  }

  @Test
  void fetchMirrorCaptions_shouldReturnEmptyWhenServiceReportsFailure() {
    givenResponse(200, "{\"success\":false,\"error\":\"Transcript is disabled\"}");

    assertThat(fetcher.fetchMirrorCaptions("abc")).isEmpty();
  }

  @Test
  void fetchMirrorCaptions_shouldReturnEmptyForFailureWithErrorStatus() {
    givenResponse(400, "{\"success\":false,\"error\":\"No transcript\"}");

    assertThat(fetcher.fetchMirrorCaptions("abc")).isEmpty();
  }

  @Test
  void fetchMirrorCaptions_shouldReturnEmptyOn404() {
    givenResponse(404, "Not Found");

    assertThat(fetcher.fetchMirrorCaptions("abc")).isEmpty();
  }

  @Test
  void fetchMirrorCaptions_shouldReturnEmptyForEmptyTrack() {
    givenResponse(200, "{\"success\":true,\"segments\":[]}");

    assertThat(fetcher.fetchMirrorCaptions("abc")).isEmpty();
  }

  @Test
  void fetchMirrorCaptions_shouldFailOnServerError() {
    givenResponse(502, "Bad Gateway");

    assertThatThrownBy(() -> fetcher.fetchMirrorCaptions("abc"))
        .isInstanceOf(TranscriptFetchException.class)
        .hasMessageContaining("HTTP 502");
  }

  @Test
  void fetchMirrorCaptions_shouldRefuseWhenNotConfigured() {
    MirrorCaptionFetcher disabled =
        new MirrorCaptionFetcher(
            httpFetcher, TestFixtures.properties("", tempDir), new ObjectMapper());

    assertThat(disabled.isEnabled()).isFalse();
    assertThatThrownBy(() -> disabled.fetchMirrorCaptions("abc"))
        .isInstanceOf(IllegalStateException.class);
  }

  private void givenResponse(int status, String body) {
    when(httpFetcher.fetch(any()))
        .thenAnswer(
            invocation ->
                new HttpPayload(
                    invocation.<FetchRequest>getArgument(0).uri(),
                    status,
                    "application/json",
                    body.getBytes(StandardCharsets.UTF_8)));
  }

  private static String captionJson(String arrayField, int count, String extraFields) {
    List<String> sentences = TestFixtures.sentences(count);
    StringBuilder json = new StringBuilder("{\"success\":true,").append(extraFields);
    json.append('"').append(arrayField).append("\":[");
    for (int i = 0; i < sentences.size(); i++) {
      if (i > 0) {
        json.append(',');
      }
      json.append(
          String.format(
              "{\"start\":%d,\"duration\":3,\"text\":\"%s\"}", i * 3, sentences.get(i)));
    }
    return json.append("]}").toString();
  }
}
