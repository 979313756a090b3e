package com.kriskowal.lino;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Separates punctuation and math symbols from adjacent characters so they become references of
 * their own, e.g. {@code hello, world} becomes {@code hello , world} and {@code 1+2} becomes
 * {@code 1 + 2}.
 *
 * <p>Punctuation is split off only after a letter or digit. Math symbols are split off only
 * between two digits, which keeps hyphenated words such as {@code Jean-Luc} intact. Quoted
 * references are left alone; a quote in the middle of a word, as in {@code it's}, does not start
 * one.
 */
public final class Tokenizer {

  public static final List<Character> DEFAULT_PUNCTUATION =
      Collections.unmodifiableList(Arrays.asList(',', '.', ';', '!', '?'));

  public static final List<Character> DEFAULT_MATH_SYMBOLS =
      Collections.unmodifiableList(Arrays.asList('+', '-', '*', '/', '=', '<', '>', '%', '^'));

  private final Set<Character> punctuation;
  private final Set<Character> mathSymbols;

  public Tokenizer() {
    this(DEFAULT_PUNCTUATION, DEFAULT_MATH_SYMBOLS);
  }

  public Tokenizer(List<Character> punctuation, List<Character> mathSymbols) {
    this.punctuation = new HashSet<>(punctuation);
    this.mathSymbols = new HashSet<>(mathSymbols);
  }

  public String tokenize(String input) {
    StringBuilder out = new StringBuilder(input.length() + 16);

    int i = 0;
    while (i < input.length()) {
      int quotedEnd = quotedSpanEnd(input, i);
      if (quotedEnd > i) {
        out.append(input, i, quotedEnd);
        i = quotedEnd;
        continue;
      }

      char c = input.charAt(i);
      char prev = i > 0 ? input.charAt(i - 1) : 0;
      char next = i + 1 < input.length() ? input.charAt(i + 1) : 0;

      if (punctuation.contains(c) && Character.isLetterOrDigit(prev)) {
        appendSpaceIfNeeded(out);
        out.append(c);
        if (Character.isLetterOrDigit(next)) {
          out.append(' ');
        }
      } else if (mathSymbols.contains(c) && Character.isDigit(prev) && Character.isDigit(next)) {
        appendSpaceIfNeeded(out);
        out.append(c).append(' ');
      } else {
        out.append(c);
      }
      i++;
    }

    return out.toString();
  }

  /** Removes the spaces {@link #tokenize} would have inserted around symbols. */
  public String compact(String output) {
    StringBuilder out = new StringBuilder(output.length());

    int i = 0;
    while (i < output.length()) {
      int quotedEnd = quotedSpanEnd(output, i);
      if (quotedEnd > i) {
        out.append(output, i, quotedEnd);
        i = quotedEnd;
        continue;
      }

      char c = output.charAt(i);
      if (c == ' ') {
        char prev = out.length() > 0 ? out.charAt(out.length() - 1) : 0;
        char next = i + 1 < output.length() ? output.charAt(i + 1) : 0;
        if (isSymbol(prev) || isSymbol(next)) {
          i++;
          continue;
        }
      }
      out.append(c);
      i++;
    }

    return out.toString();
  }

  // End of the quoted reference starting at i, or -1 if none starts there. A quote opens a
  // reference only at the start of a token; an unterminated one runs to the end of the text.
  private static int quotedSpanEnd(String text, int i) {
    if (!ReferenceScanner.isQuote(text.charAt(i))
        || (i > 0 && !ReferenceScanner.isDelimiter(text.charAt(i - 1)))) {
      return -1;
    }
    ReferenceScanner.ScannedReference ref =
        ReferenceScanner.tryScanQuoted(text, i, text.length());
    return ref != null ? ref.end : text.length();
  }

  private boolean isSymbol(char c) {
    return punctuation.contains(c) || mathSymbols.contains(c);
  }

  private static void appendSpaceIfNeeded(StringBuilder out) {
    if (out.length() == 0) {
      return;
    }
    char last = out.charAt(out.length() - 1);
    if (last != ' ' && last != '\t' && last != '\n') {
      out.append(' ');
    }
  }
}
