package com.kriskowal.lino;

/** A 1-based line and column inside a source text. */
final class SourcePosition {

  private final int line;
  private final int col;

  private SourcePosition(int line, int col) {
    this.line = line;
    this.col = col;
  }

  static SourcePosition of(String text, int offset) {
    int line = 1;
    int col = 1;
    int limit = Math.min(offset, text.length());
    for (int i = 0; i < limit; i++) {
      if (text.charAt(i) == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
    }
    return new SourcePosition(line, col);
  }

  int line() {
    return line;
  }

  int col() {
    return col;
  }

  @Override
  public String toString() {
    return line + ":" + col;
  }
}
