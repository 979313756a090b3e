package com.kriskowal.lino;

/**
 * One logical line of a document. It may span several physical lines when a parenthesized
 * expression or a quoted reference contains newlines.
 *
 * <p>{@code start} and {@code end} delimit the content with leading and trailing whitespace
 * removed, as offsets into the full source text.
 */
final class LogicalLine {
  final int start;
  final int end;
  final int rawIndent;
  final int lineNum;

  LogicalLine(int start, int end, int rawIndent, int lineNum) {
    this.start = start;
    this.end = end;
    this.rawIndent = rawIndent;
    this.lineNum = lineNum;
  }

  boolean isBlank() {
    return start >= end;
  }

  String content(String text) {
    return text.substring(start, end);
  }
}
