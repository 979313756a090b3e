package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into logical lines.
 *
 * <p>A newline ends a logical line only when it is outside every quoted reference and every
 * parenthesized expression. Quoted references are skipped with {@link ReferenceScanner}, so the
 * segmenter and the item parser always agree on where a quote ends.
 */
final class LineSegmenter {

  private LineSegmenter() {}

  /** Returns the non-blank logical lines of {@code text} in order. */
  static List<LogicalLine> segment(String text, String filename) {
    List<LogicalLine> lines = new ArrayList<>();
    int length = text.length();
    int lineStart = 0;
    int lineNum = 1;
    int physicalLine = 1;
    int depth = 0;
    int outermostOpen = -1;

    int i = 0;
    while (i < length) {
      char c = text.charAt(i);

      if (c == '\n') {
        if (depth == 0) {
          addLine(lines, text, lineStart, i, lineNum);
          lineStart = i + 1;
          lineNum = physicalLine + 1;
        }
        physicalLine++;
        i++;
      } else if (ReferenceScanner.isWhitespace(c) || c == ':') {
        i++;
      } else if (c == '(') {
        if (depth == 0) {
          outermostOpen = i;
        }
        depth++;
        i++;
      } else if (c == ')') {
        if (depth == 0) {
          throw new LinoException(
              LinoException.Kind.UNBALANCED_PARENTHESES,
              "Unexpected \")\"",
              filename,
              SourcePosition.of(text, i));
        }
        depth--;
        i++;
      } else {
        ReferenceScanner.ScannedReference ref = ReferenceScanner.scan(text, i, length, filename);
        physicalLine += countNewlines(text, i, ref.end);
        i = ref.end;
      }
    }

    if (depth > 0) {
      throw new LinoException(
          LinoException.Kind.UNBALANCED_PARENTHESES,
          "Unclosed \"(\"",
          filename,
          SourcePosition.of(text, outermostOpen));
    }
    addLine(lines, text, lineStart, length, lineNum);
    return lines;
  }

  private static void addLine(List<LogicalLine> lines, String text, int from, int to, int lineNum) {
    int indent = 0;
    int start = from;
    while (start < to && (text.charAt(start) == ' ' || text.charAt(start) == '\t')) {
      indent++;
      start++;
    }
    int end = to;
    while (end > start && ReferenceScanner.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    LogicalLine line = new LogicalLine(start, end, indent, lineNum);
    if (!line.isBlank()) {
      lines.add(line);
    }
  }

  private static int countNewlines(String text, int from, int to) {
    int count = 0;
    for (int i = from; i < to; i++) {
      if (text.charAt(i) == '\n') {
        count++;
      }
    }
    return count;
  }
}
