package com.kriskowal.lino;

/**
 * Recognizes one reference token: either a simple word or a quoted reference.
 *
 * <p>A quoted reference opens with a run of N identical quote characters ({@code "}, {@code '} or
 * {@code `}) and closes with a run of exactly N. Inside, a run of 2N quotes stands for N literal
 * quotes. N is counted per occurrence and has no upper bound, so {@code "a" "b"} is two
 * references while {@code ''a''''b''} is the single reference {@code a''b}.
 *
 * <p>A quote character in the middle of a simple word is an ordinary character.
 */
final class ReferenceScanner {

  private ReferenceScanner() {}

  /** Result of a successful scan. */
  static final class ScannedReference {
    final String value;
    final int end;
    final boolean quoted;

    ScannedReference(String value, int end, boolean quoted) {
      this.value = value;
      this.end = end;
      this.quoted = quoted;
    }
  }

  static boolean isQuote(char c) {
    return c == '"' || c == '\'' || c == '`';
  }

  static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  /** Characters that end a simple reference. */
  static boolean isDelimiter(char c) {
    return isWhitespace(c) || c == '(' || c == ')' || c == ':';
  }

  /**
   * Scans a reference starting at {@code pos}, never reading at or past {@code end}.
   *
   * @return the reference and the offset just after it, or null if no reference starts here
   * @throws LinoException if a quoted reference is not closed before {@code end}
   */
  static ScannedReference scan(String text, int pos, int end, String filename) {
    if (pos >= end) {
      return null;
    }
    char c = text.charAt(pos);
    if (isQuote(c)) {
      return scanQuoted(text, pos, end, filename);
    }
    int i = pos;
    while (i < end && !isDelimiter(text.charAt(i))) {
      i++;
    }
    if (i == pos) {
      return null;
    }
    return new ScannedReference(text.substring(pos, i), i, false);
  }

  private static ScannedReference scanQuoted(String text, int pos, int end, String filename) {
    ScannedReference ref = tryScanQuoted(text, pos, end);
    if (ref == null) {
      throw new LinoException(
          LinoException.Kind.UNTERMINATED_QUOTE,
          "Unterminated quoted reference",
          filename,
          SourcePosition.of(text, pos));
    }
    return ref;
  }

  /**
   * Scans the quoted reference whose opening run starts at {@code pos}.
   *
   * @return the reference, or null if it is not closed before {@code end}
   */
  static ScannedReference tryScanQuoted(String text, int pos, int end) {
    char quote = text.charAt(pos);
    int level = runLength(text, pos, end, quote);

    StringBuilder content = new StringBuilder();
    int i = pos + level;
    while (i < end) {
      int run = runLength(text, i, end, quote);
      if (run >= 2 * level) {
        // Escape: 2N quotes stand for N literal quotes
        for (int k = 0; k < level; k++) {
          content.append(quote);
        }
        i += 2 * level;
        continue;
      }
      if (run == level) {
        return new ScannedReference(content.toString(), i + level, true);
      }
      content.append(text.charAt(i));
      i++;
    }
    return null;
  }

  private static int runLength(String text, int pos, int end, char quote) {
    int i = pos;
    while (i < end && text.charAt(i) == quote) {
      i++;
    }
    return i - pos;
  }
}
