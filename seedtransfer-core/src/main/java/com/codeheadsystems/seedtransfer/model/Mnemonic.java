package com.codeheadsystems.seedtransfer.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An ordered list of recovery words. The list is kept exactly as given; validity
 * (count, vocabulary, checksum) is the business of the mnemonic codec.
 *
 * @param words the words, in order
 */
public record Mnemonic(List<String> words) {

  public Mnemonic {
    Objects.requireNonNull(words, "words");
    words = List.copyOf(words);
  }

  /**
   * Parses user-entered text: trims, lowercases and splits on any run of whitespace.
   *
   * @param phrase the typed or scanned phrase
   * @return the mnemonic
   */
  public static Mnemonic parse(String phrase) {
    Objects.requireNonNull(phrase, "phrase");
    String normalized = phrase.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      return new Mnemonic(List.of());
    }
    return new Mnemonic(Arrays.asList(normalized.split("\\s+")));
  }

  /**
   * @return the number of words
   */
  public int size() {
    return words.size();
  }

  /**
   * Words {@code from} (inclusive) to {@code to} (exclusive) as a new mnemonic.
   *
   * @param from start index
   * @param to   end index
   * @return the sub-list
   */
  public Mnemonic slice(int from, int to) {
    return new Mnemonic(words.subList(from, to));
  }

  /**
   * @return the words joined by single spaces
   */
  public String phrase() {
    return String.join(" ", words);
  }

  @Override
  public String toString() {
    return "Mnemonic[" + words.size() + " words]";
  }
}
