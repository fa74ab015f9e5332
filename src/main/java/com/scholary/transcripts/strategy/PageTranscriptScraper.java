package com.scholary.transcripts.strategy;

import com.scholary.transcripts.config.AcquisitionProperties;
import com.scholary.transcripts.http.FetchRequest;
import com.scholary.transcripts.http.HttpFetcher;
import com.scholary.transcripts.http.HttpPayload;
import com.scholary.transcripts.transcript.StrategyTag;
import com.scholary.transcripts.transcript.Transcript;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds a transcript embedded in an episode or article web page.
 *
 * <p>After stripping page chrome, five heuristics are tried in order and the first candidate that
 * survives cleaning with at least {@link Transcript#MIN_LENGTH} characters wins:
 *
 * <ol>
 *   <li>a heading mentioning the transcript, with the content that follows it
 *   <li>a {@code <details>} block whose summary mentions the transcript
 *   <li>a newsletter body whose paragraphs follow a transcript label or read as speaker turns
 *   <li>containers whose class or id names a transcript
 *   <li>generic disclosure and ARIA-labelled transcript containers
 * </ol>
 *
 * <p>Links to separate transcript pages are logged but never followed.
 */
@Component
public class PageTranscriptScraper {

  private static final Logger LOGGER = LoggerFactory.getLogger(PageTranscriptScraper.class);

  static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

  private static final String NOISE = "script, style, noscript, nav, header, footer, aside";
  private static final String HEADINGS = "h1, h2, h3, h4, h5, h6";
  private static final String NEWSLETTER_BODIES =
      ".post-content, .available-content, .body, .entry-content";
  private static final List<String> EXPLICIT_CONTAINERS =
      List.of(
          "[class*=transcript]",
          "[id*=transcript]",
          ".episode-transcript",
          ".podcast-transcript",
          ".full-transcript",
          ".show-transcript",
          "#transcript");
  private static final List<String> DISCLOSURE_CONTAINERS =
      List.of(
          "[data-transcript]",
          "[aria-label*=transcript]",
          ".transcript-container",
          ".transcript-wrapper",
          ".show-notes-transcript");

  private static final Pattern TRANSCRIPT_LABEL =
      Pattern.compile(
          "transcript|full text|episode text|read the conversation", Pattern.CASE_INSENSITIVE);
  private static final Pattern DETAILS_LABEL =
      Pattern.compile(
          "transcript|full text|episode text|read the conversation|show text",
          Pattern.CASE_INSENSITIVE);
  private static final List<Pattern> SPEAKER_LINES =
      List.of(
          Pattern.compile("^[\\w .'-]{1,40}:\\s", Pattern.UNICODE_CHARACTER_CLASS),
          Pattern.compile("^\\*\\*[\\w .'-]{1,40}:\\*\\*", Pattern.UNICODE_CHARACTER_CLASS),
          Pattern.compile("^\\[[\\w .'-]{1,40}\\]", Pattern.UNICODE_CHARACTER_CLASS));

  private static final int MAX_LABEL_LENGTH = 100;
  private static final int MIN_PARAGRAPH_LENGTH = 20;
  private static final int MIN_NEWSLETTER_PARAGRAPHS = 10;

  private final HttpFetcher httpFetcher;
  private final AcquisitionProperties properties;

  public PageTranscriptScraper(HttpFetcher httpFetcher, AcquisitionProperties properties) {
    this.httpFetcher = httpFetcher;
    this.properties = properties;
  }

  /**
   * Fetch a page and extract an embedded transcript.
   *
   * @param pageUrl the episode or article page
   * @return the transcript, or empty when no heuristic finds enough text
   * @throws com.scholary.transcripts.http.TranscriptFetchException on non-2xx, timeout, connection
   *     failure or a page over the size cap
   */
  public Optional<Transcript> scrapePage(URI pageUrl) {
    FetchRequest request =
        new FetchRequest(
            pageUrl,
            properties.http().browserUserAgent(),
            ACCEPT,
            properties.scraper().timeout(),
            properties.scraper().maxPageBytes());

    HttpPayload payload = httpFetcher.fetch(request).requireSuccess();
    Document document = Jsoup.parse(payload.bodyAsText(), pageUrl.toString());

    Optional<String> text = findTranscriptText(document);
    if (text.isEmpty()) {
      logTranscriptLinks(document, pageUrl);
      return Optional.empty();
    }
    return Transcript.from(text.get(), List.of(), null, StrategyTag.PAGE_SCRAPED);
  }

  /**
   * Run the heuristics against a parsed page. The document is modified: page chrome is removed.
   *
   * @return cleaned transcript text of at least the minimum length, or empty
   */
  Optional<String> findTranscriptText(Document document) {
    document.select(NOISE).remove();

    List<Function<Document, Optional<String>>> heuristics =
        List.of(
            this::fromHeadingSection,
            this::fromDetails,
            this::fromNewsletterBody,
            doc -> fromContainers(doc, EXPLICIT_CONTAINERS),
            doc -> fromContainers(doc, DISCLOSURE_CONTAINERS));

    for (Function<Document, Optional<String>> heuristic : heuristics) {
      Optional<String> text = heuristic.apply(document);
      if (text.isPresent()) {
        return text;
      }
    }
    return Optional.empty();
  }

  private Optional<String> fromHeadingSection(Document document) {
    for (Element heading : document.select(HEADINGS)) {
      if (!TRANSCRIPT_LABEL.matcher(heading.text()).find()) {
        continue;
      }

      Optional<String> section = accept(sectionAfter(heading));
      if (section.isPresent()) {
        LOGGER.debug("Transcript found after heading: {}", heading.text());
        return section;
      }

      Element parent = heading.parent();
      if (parent != null && !isDocumentRoot(parent)) {
        Optional<String> container = accept(BlockText.of(parent));
        if (container.isPresent()) {
          LOGGER.debug("Transcript found in container of heading: {}", heading.text());
          return container;
        }
      }
    }
    return Optional.empty();
  }

  /** Content following a heading up to the next heading of the same or a higher level. */
  private static String sectionAfter(Element heading) {
    int level = headingLevel(heading);
    StringBuilder section = new StringBuilder();
    for (Node sibling = heading.nextSibling(); sibling != null; sibling = sibling.nextSibling()) {
      if (sibling instanceof Element element) {
        int siblingLevel = headingLevel(element);
        if (siblingLevel > 0 && siblingLevel <= level) {
          break;
        }
        section.append(BlockText.of(element)).append("\n\n");
      } else if (sibling instanceof TextNode textNode) {
        section.append(textNode.text());
      }
    }
    return section.toString();
  }

  private Optional<String> fromDetails(Document document) {
    for (Element details : document.select("details")) {
      Element summary = details.selectFirst("summary");
      if (summary != null && DETAILS_LABEL.matcher(summary.text()).find()) {
        Optional<String> text = accept(BlockText.of(details));
        if (text.isPresent()) {
          LOGGER.debug("Transcript found in details block: {}", summary.text());
          return text;
        }
      }
    }
    return Optional.empty();
  }

  private Optional<String> fromNewsletterBody(Document document) {
    for (Element body : document.select(NEWSLETTER_BODIES)) {
      List<String> paragraphs = new ArrayList<>();
      boolean afterLabel = false;
      for (Element paragraph : body.select("p")) {
        String text = paragraph.text().trim();
        if (!afterLabel
            && text.length() < MAX_LABEL_LENGTH
            && TRANSCRIPT_LABEL.matcher(text).find()) {
          afterLabel = true;
          continue;
        }
        if (text.length() > MIN_PARAGRAPH_LENGTH && (afterLabel || isSpeakerLine(text))) {
          paragraphs.add(text);
        }
      }

      if (paragraphs.size() >= MIN_NEWSLETTER_PARAGRAPHS) {
        Optional<String> text = accept(String.join("\n\n", paragraphs));
        if (text.isPresent()) {
          LOGGER.debug("Transcript found in newsletter body: paragraphs={}", paragraphs.size());
          return text;
        }
      }
    }
    return Optional.empty();
  }

  private Optional<String> fromContainers(Document document, List<String> selectors) {
    for (String selector : selectors) {
      for (Element container : document.select(selector)) {
        if (isDocumentRoot(container)) {
          continue;
        }
        Optional<String> text = accept(BlockText.of(container));
        if (text.isPresent()) {
          LOGGER.debug("Transcript found in container: selector={}", selector);
          return text;
        }
      }
    }
    return Optional.empty();
  }

  private void logTranscriptLinks(Document document, URI pageUrl) {
    for (Element link : document.select("a[href]")) {
      String href = link.attr("abs:href");
      if (href.isEmpty() || href.startsWith("mailto:")) {
        continue;
      }
      if (TRANSCRIPT_LABEL.matcher(link.text()).find()
          || href.toLowerCase(Locale.ROOT).contains("transcript")) {
        LOGGER.info(
            "Page links to a transcript that is not followed: page={}, link={}", pageUrl, href);
      }
    }
  }

  private static Optional<String> accept(String raw) {
    String cleaned = TranscriptTextCleaner.clean(raw);
    return Transcript.meetsMinimumLength(cleaned) ? Optional.of(cleaned) : Optional.empty();
  }

  private static boolean isSpeakerLine(String text) {
    return SPEAKER_LINES.stream().anyMatch(pattern -> pattern.matcher(text).find());
  }

  private static boolean isDocumentRoot(Element element) {
    String name = element.normalName();
    return name.equals("body") || name.equals("html") || name.equals("#root");
  }

  private static int headingLevel(Element element) {
    String name = element.normalName();
    if (name.length() == 2 && name.charAt(0) == 'h' && Character.isDigit(name.charAt(1))) {
      return name.charAt(1) - '0';
    }
    return 0;
  }
}
