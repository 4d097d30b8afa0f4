package com.flamingo.ai.contentpipeline.service.pipeline.quality;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Deterministic text helpers shared by the scorer and the stages. */
public final class TextAnalysis {

  private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^\\s*#{1,6}\\s.*$");

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her",
          "was", "one", "our", "out", "has", "have", "this", "that", "with", "from", "they",
          "will", "would", "there", "their", "what", "about", "which", "when", "make", "like",
          "into", "than", "them", "then", "these", "some", "its", "also", "more", "other", "such",
          "only", "your", "how", "use", "using", "used", "each", "may", "most", "very", "been",
          "being", "were", "does", "did", "who", "why", "where", "while", "over", "under");

  private TextAnalysis() {}

  /** Lower-cased words, in order, including stop words. */
  public static List<String> words(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
        .filter(w -> !w.isEmpty())
        .toList();
  }

  /** Distinct content words: longer than two characters and not a stop word. */
  public static Set<String> contentTokens(String text) {
    Set<String> tokens = new LinkedHashSet<>();
    for (String word : words(text)) {
      if (word.length() > 2 && !STOP_WORDS.contains(word)) {
        tokens.add(word);
      }
    }
    return tokens;
  }

  public static int wordCount(String text) {
    return words(text).size();
  }

  /** Sentences of the text, with markdown heading lines removed. */
  public static List<String> sentences(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    StringBuilder prose = new StringBuilder();
    for (String line : text.split("\n")) {
      if (!MARKDOWN_HEADING.matcher(line).matches()) {
        prose.append(line.strip()).append(' ');
      }
    }
    List<String> sentences = new ArrayList<>();
    for (String sentence : SENTENCE_SPLIT.split(prose.toString().strip())) {
      if (!sentence.isBlank()) {
        sentences.add(sentence.strip());
      }
    }
    return sentences;
  }

  /** Word trigrams of the text. */
  public static Set<String> shingles(String text) {
    List<String> words = words(text);
    Set<String> shingles = new LinkedHashSet<>();
    for (int i = 0; i + 2 < words.size(); i++) {
      shingles.add(words.get(i) + " " + words.get(i + 1) + " " + words.get(i + 2));
    }
    return shingles;
  }

  /** Heading reduced to its words, for matching generated headings against the outline. */
  public static String normalizeHeading(String heading) {
    return String.join(" ", words(heading));
  }

  /** Share of {@code tokens} that also occur in {@code reference}, 0 when tokens is empty. */
  public static double coverage(Set<String> tokens, Set<String> reference) {
    if (tokens.isEmpty()) {
      return 0;
    }
    long hits = tokens.stream().filter(reference::contains).count();
    return (double) hits / tokens.size();
  }
}
