package com.scholary.transcripts.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.transcripts.TestFixtures;
import com.scholary.transcripts.http.FetchRequest;
import com.scholary.transcripts.http.HttpFetcher;
import com.scholary.transcripts.http.HttpPayload;
import com.scholary.transcripts.http.TranscriptFetchException;
import com.scholary.transcripts.transcript.Confidence;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PageTranscriptScraperTest {

  private static final URI PAGE = URI.create("https://example.com/episodes/42");

  @Mock private HttpFetcher httpFetcher;

  @TempDir Path tempDir;

  private PageTranscriptScraper scraper;

  @BeforeEach
  void setUp() {
    scraper = new PageTranscriptScraper(httpFetcher, TestFixtures.properties("", tempDir));
  }

  @Test
  void scrapePage_shouldExtractSectionAfterTranscriptHeading() {
    String html =
        page(
            "<h1>Episode 42</h1><p>Show notes intro.</p>"
                + "<h2>Full Transcript</h2>"
                + paragraphs(10)
                + "<h2>Related episodes</h2><p>Something unrelated entirely.</p>");
    givenPage(html);

    Transcript transcript = scraper.scrapePage(PAGE).orElseThrow();

    assertThat(transcript.source()).isEqualTo(StrategyTag.PAGE_SCRAPED);
    assertThat(transcript.confidence()).isEqualTo(Confidence.MEDIUM);
    assertThat(transcript.fullText())
        .startsWith("Sentence number 1 ")
        .doesNotContain("Something unrelated")
        .doesNotContain("Show notes intro");
    assertThat(transcript.segments()).hasSize(10);
  }

  @Test
  void scrapePage_shouldSendBrowserUserAgentWithinSizeCap() {
    givenPage(page("<h2>Transcript</h2>" + paragraphs(10)));

    scraper.scrapePage(PAGE);

    ArgumentCaptor<FetchRequest> captor = ArgumentCaptor.forClass(FetchRequest.class);
    verify(httpFetcher).fetch(captor.capture());
    assertThat(captor.getValue().userAgent()).isEqualTo(TestFixtures.BROWSER_USER_AGENT);
    assertThat(captor.getValue().maxBodyBytes()).isEqualTo(10_000_000);
    assertThat(captor.getValue().accept()).contains("text/html");
  }

  @Test
  void scrapePage_shouldReturnEmptyWhenTranscriptSectionIsTooShort() {
    givenPage(page("<h2>Transcript</h2><p>Coming soon.</p>"));

    assertThat(scraper.scrapePage(PAGE)).isEmpty();
  }

  @Test
  void scrapePage_shouldPropagateHttpErrors() {
    when(httpFetcher.fetch(any()))
        .thenReturn(new HttpPayload(PAGE, 503, "text/html", new byte[0]));

    assertThatThrownBy(() -> scraper.scrapePage(PAGE))
        .isInstanceOf(TranscriptFetchException.class)
        .hasMessageContaining("HTTP 503");
  }

  @Test
  void findTranscriptText_shouldFallBackToHeadingContainer() {
    String html =
        page(
            "<div class=\"episode\"><h3>Read the conversation</h3><p>Edited for clarity.</p>"
                + "<h3>Part one</h3>"
                + paragraphs(10)
                + "</div>");

    Optional<String> text = scraper.findTranscriptText(Jsoup.parse(html));

    assertThat(text).isPresent();
    assertThat(text.get()).contains("Sentence number 10 ");
  }

  @Test
  void findTranscriptText_shouldUseDetailsBlock() {
    String html = page("<details><summary>Show text</summary>" + paragraphs(10) + "</details>");

    assertThat(scraper.findTranscriptText(Jsoup.parse(html)))
        .hasValueSatisfying(text -> assertThat(text).contains("Sentence number 7 "));
  }

  @Test
  void findTranscriptText_shouldCollectNewsletterParagraphsAfterLabel() {
    String html =
        page(
            "<div class=\"available-content\"><p>Welcome to this week's issue of the letter.</p>"
                + "<p>Transcript</p>"
                + paragraphs(12)
                + "</div>");

    Optional<String> text = scraper.findTranscriptText(Jsoup.parse(html));

    assertThat(text).isPresent();
    assertThat(text.get()).doesNotContain("Welcome to this week").contains("Sentence number 12 ");
  }

  @Test
  void findTranscriptText_shouldCollectNewsletterSpeakerLines() {
    String speakerTurns =
        TestFixtures.sentences(10).stream()
            .map(sentence -> "<p>Alice Smith: " + sentence + "</p>")
            .collect(Collectors.joining());
    String html =
        page("<div class=\"post-content\"><p>A short intro line.</p>" + speakerTurns + "</div>");

    Optional<String> text = scraper.findTranscriptText(Jsoup.parse(html));

    assertThat(text).isPresent();
    assertThat(text.get()).startsWith("Alice Smith: Sentence number 1 ");
  }

  @Test
  void findTranscriptText_shouldRequireTenNewsletterParagraphs() {
    String html =
        page("<div class=\"post-content\"><p>Transcript</p>" + paragraphs(9) + "</div>");

    assertThat(scraper.findTranscriptText(Jsoup.parse(html))).isEmpty();
  }

  @Test
  void findTranscriptText_shouldUseExplicitTranscriptContainer() {
    String html = page("<div id=\"episode-transcript\">" + paragraphs(10) + "</div>");

    assertThat(scraper.findTranscriptText(Jsoup.parse(html))).isPresent();
  }

  @Test
  void findTranscriptText_shouldUseAriaLabelledContainer() {
    String html =
        page("<section aria-label=\"Episode Transcript\">" + paragraphs(10) + "</section>");

    assertThat(scraper.findTranscriptText(Jsoup.parse(html))).isPresent();
  }

  @Test
  void findTranscriptText_shouldIgnoreTextInsidePageChrome() {
    String html =
        page("<footer class=\"transcript\">" + paragraphs(10) + "</footer><p>Body copy.</p>");

    assertThat(scraper.findTranscriptText(Jsoup.parse(html))).isEmpty();
  }

  @Test
  void findTranscriptText_shouldPreferHeadingOverContainer() {
    String containerText =
        "<div class=\"transcript-box\">"
            + "<p>"
            + "Container copy that should lose to the heading section. ".repeat(12)
            + "</p></div>";
    String html = page("<h2>Transcript</h2>" + paragraphs(10) + containerText);

    assertThat(scraper.findTranscriptText(Jsoup.parse(html)))
        .hasValueSatisfying(text -> assertThat(text).startsWith("Sentence number 1 "));
  }

  private void givenPage(String html) {
    when(httpFetcher.fetch(any()))
        .thenReturn(
            new HttpPayload(
                PAGE, 200, "text/html; charset=utf-8", html.getBytes(StandardCharsets.UTF_8)));
  }

  private static String page(String body) {
    return "<html><head><title>Episode</title><script>var tracking = true;</script></head>"
        + "<body><nav>Home | Episodes | About</nav>"
        + body
        + "</body></html>";
  }

  private static String paragraphs(int count) {
    List<String> sentences = TestFixtures.sentences(count);
    return sentences.stream().map(s -> "<p>" + s + "</p>").collect(Collectors.joining());
  }
}
