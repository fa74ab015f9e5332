package com.scholary.transcripts.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.transcripts.TestFixtures;
import com.scholary.transcripts.http.FailureKind;
import com.scholary.transcripts.http.FetchRequest;
import com.scholary.transcripts.http.HttpFetcher;
import com.scholary.transcripts.http.TranscriptFetchException;
import com.scholary.transcripts.transcript.Confidence;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import com.scholary.transcripts.transcript.TranscriptSegment;
import com.scholary.transcripts.whisper.WhisperException;
import com.scholary.transcripts.whisper.WhisperProperties;
import com.scholary.transcripts.whisper.WhisperResponse;
import com.scholary.transcripts.whisper.WhisperSegment;
import com.scholary.transcripts.whisper.WhisperService;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SpeechToTextTranscriberTest {

  private static final URI AUDIO_URL = URI.create("https://cdn.example.com/episodes/42.m4a");

  @Mock private HttpFetcher httpFetcher;
  @Mock private WhisperService whisperService;

  @TempDir Path tempDir;

  private SpeechToTextTranscriber transcriber;

  @BeforeEach
  void setUp() {
    transcriber =
        new SpeechToTextTranscriber(
            httpFetcher,
            whisperService,
            whisperProperties("sk-test"),
            TestFixtures.properties("", tempDir));
  }

  @Test
  void transcribeAudio_shouldDownloadTranscribeAndBuildTimedSegments() throws IOException {
    givenDownloadSucceeds();
    List<String> sentences = TestFixtures.sentences(10);
    WhisperResponse response =
        new WhisperResponse(String.join(" ", sentences), "english", 60.0, segments(sentences));
    when(whisperService.transcribe(any(Path.class), eq("audio/mp4"))).thenReturn(response);

    Transcript transcript = transcriber.transcribeAudio(AUDIO_URL, 600.0).orElseThrow();

    assertThat(transcript.source()).isEqualTo(StrategyTag.SPEECH_TO_TEXT);
    assertThat(transcript.confidence()).isEqualTo(Confidence.MEDIUM);
    assertThat(transcript.language()).isEqualTo("en");
    assertThat(transcript.segments()).hasSize(10).allMatch(TranscriptSegment::isTimed);
    assertThat(transcript.segments().get(1).start()).isEqualTo(6.0);
    assertThat(transcript.segments().get(1).duration()).isEqualTo(6.0);
  }

  @Test
  void transcribeAudio_shouldDeleteTempFileAfterwards() throws IOException {
    givenDownloadSucceeds();
    when(whisperService.transcribe(any(Path.class), any()))
        .thenReturn(new WhisperResponse(TestFixtures.prose(10), "en", 60.0, List.of()));

    transcriber.transcribeAudio(AUDIO_URL, null);

    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  void transcribeAudio_shouldUseSpeechLimitsForDownload() {
    givenDownloadSucceeds();
    when(whisperService.transcribe(any(Path.class), any()))
        .thenReturn(new WhisperResponse(TestFixtures.prose(10), "en", 60.0, List.of()));

    transcriber.transcribeAudio(AUDIO_URL, null);

    ArgumentCaptor<FetchRequest> request = ArgumentCaptor.forClass(FetchRequest.class);
    ArgumentCaptor<Path> target = ArgumentCaptor.forClass(Path.class);
    verify(httpFetcher).download(request.capture(), target.capture());
    assertThat(request.getValue().maxBodyBytes()).isEqualTo(25_000_000);
    assertThat(target.getValue().getFileName().toString()).endsWith(".m4a");
  }

  @Test
  void transcribeAudio_shouldRejectOverlongAudioBeforeDownloading() {
    assertThatThrownBy(() -> transcriber.transcribeAudio(AUDIO_URL, 7200.5))
        .isInstanceOf(TranscriptFetchException.class)
        .hasMessageContaining("exceeds 7200s")
        .extracting(e -> ((TranscriptFetchException) e).getKind())
        .isEqualTo(FailureKind.RESOURCE_LIMIT);
    verifyNoInteractions(httpFetcher, whisperService);
  }

  @Test
  void transcribeAudio_shouldReturnEmptyForEmptyRecognition() {
    givenDownloadSucceeds();
    when(whisperService.transcribe(any(Path.class), any()))
        .thenReturn(new WhisperResponse("  ", "en", 60.0, List.of()));

    assertThat(transcriber.transcribeAudio(AUDIO_URL, null)).isEmpty();
  }

  @Test
  void transcribeAudio_shouldWrapTranscriptionFailure() {
    givenDownloadSucceeds();
    when(whisperService.transcribe(any(Path.class), any()))
        .thenThrow(new WhisperException("Whisper API rejected request with status 401"));

    assertThatThrownBy(() -> transcriber.transcribeAudio(AUDIO_URL, null))
        .isInstanceOf(TranscriptFetchException.class)
        .hasMessageContaining("status 401")
        .extracting(e -> ((TranscriptFetchException) e).getKind())
        .isEqualTo(FailureKind.TRANSPORT);
  }

  @Test
  void transcribeAudio_shouldPropagateDownloadFailureWithoutTranscribing() {
    when(httpFetcher.download(any(), any()))
        .thenThrow(TranscriptFetchException.tooLarge("Response exceeded 25000000 byte limit"));

    assertThatThrownBy(() -> transcriber.transcribeAudio(AUDIO_URL, null))
        .isInstanceOf(TranscriptFetchException.class);
    verify(whisperService, never()).transcribe(any(), any());
  }

  @Test
  void isEnabled_shouldRequireApiKey() {
    SpeechToTextTranscriber unconfigured =
        new SpeechToTextTranscriber(
            httpFetcher,
            whisperService,
            whisperProperties(""),
            TestFixtures.properties("", tempDir));

    assertThat(transcriber.isEnabled()).isTrue();
    assertThat(unconfigured.isEnabled()).isFalse();
  }

  @Test
  void toLanguageCode_shouldMapEnglishNamesToIsoCodes() {
    assertThat(SpeechToTextTranscriber.toLanguageCode("english")).isEqualTo("en");
    assertThat(SpeechToTextTranscriber.toLanguageCode("German")).isEqualTo("de");
    assertThat(SpeechToTextTranscriber.toLanguageCode("es")).isEqualTo("es");
    assertThat(SpeechToTextTranscriber.toLanguageCode(null)).isNull();
  }

  private void givenDownloadSucceeds() {
    when(httpFetcher.download(any(), any()))
        .thenAnswer(
            invocation -> {
              Path target = invocation.getArgument(1);
              Files.write(target, new byte[2048]);
              return 2048L;
            });
  }

  private static List<WhisperSegment> segments(List<String> sentences) {
    List<WhisperSegment> segments = new ArrayList<>();
    for (int i = 0; i < sentences.size(); i++) {
      segments.add(new WhisperSegment(i * 6.0, i * 6.0 + 6.0, sentences.get(i)));
    }
    return segments;
  }

  private static WhisperProperties whisperProperties(String apiKey) {
    return new WhisperProperties("https://api.openai.com", apiKey, "whisper-1", 10, 600, 3);
  }
}
