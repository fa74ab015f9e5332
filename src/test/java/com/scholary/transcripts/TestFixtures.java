package com.scholary.transcripts;

import com.scholary.transcripts.config.AcquisitionProperties;
import com.scholary.transcripts.config.AcquisitionProperties.FeedProperties;
import com.scholary.transcripts.config.AcquisitionProperties.HttpProperties;
import com.scholary.transcripts.config.AcquisitionProperties.MirrorProperties;
import com.scholary.transcripts.config.AcquisitionProperties.ScraperProperties;
import com.scholary.transcripts.config.AcquisitionProperties.SpeechProperties;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Shared test data. */
public final class TestFixtures {

  public static final String USER_AGENT = "TranscriptAcquirer/test";
  public static final String BROWSER_USER_AGENT = "Mozilla/5.0 (test)";

  private TestFixtures() {}

  public static AcquisitionProperties properties(String mirrorBaseUrl, Path tempDir) {
    return new AcquisitionProperties(
        new HttpProperties(USER_AGENT, BROWSER_USER_AGENT, 5),
        new FeedProperties(15, 5_000_000),
        new ScraperProperties(20, 10_000_000),
        new MirrorProperties(mirrorBaseUrl, 30),
        new SpeechProperties(7200, 25_000_000, 60, tempDir.toString()),
        2,
        10);
  }

  /** Distinct sentences, each about 70 characters, so ten of them clear the minimum length. */
  public static List<String> sentences(int count) {
    List<String> sentences = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      sentences.add(
          "Sentence number " + i + " explains another part of the episode in some detail.");
    }
    return sentences;
  }

  /** Prose of the given number of sentences on one line. */
  public static String prose(int sentenceCount) {
    return String.join(" ", sentences(sentenceCount));
  }
}
