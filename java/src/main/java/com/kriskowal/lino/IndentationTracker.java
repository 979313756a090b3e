package com.kriskowal.lino;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the raw item tree of a document from its logical lines.
 *
 * <p>Indentation is measured relative to the first line, so a block parses the same no matter how
 * far it is indented as a whole. A line indented deeper than the previous line starts a run of
 * children under it; the first child's indentation is the one its siblings use. A dedent that
 * lands between two open levels closes the deeper runs and continues the last one closed, so the
 * line stays a child of the level it did not fully return to.
 */
final class IndentationTracker {

  private static final Logger LOG = LoggerFactory.getLogger(IndentationTracker.class);

  private static final class Level {
    final int indent;
    final List<RawItem> items;

    Level(int indent, List<RawItem> items) {
      this.indent = indent;
      this.items = items;
    }
  }

  private final String text;
  private final String filename;
  private final ParserOptions options;
  private final ItemParser itemParser;

  IndentationTracker(String text, String filename, ParserOptions options) {
    this.text = text;
    this.filename = filename;
    this.options = options;
    this.itemParser = new ItemParser(text, filename, options);
  }

  List<RawItem> parseDocument(List<LogicalLine> lines) {
    List<RawItem> roots = new ArrayList<>();
    if (lines.isEmpty()) {
      return roots;
    }

    int baseIndent = lines.get(0).rawIndent;
    Deque<Level> levels = new ArrayDeque<>();
    levels.push(new Level(0, roots));
    RawItem last = null;

    for (LogicalLine line : lines) {
      int indent = Math.max(0, line.rawIndent - baseIndent);

      if (indent > levels.peek().indent && last != null) {
        if (levels.size() > options.getMaxDepth()) {
          throw error(
              LinoException.Kind.RECURSION_TOO_DEEP,
              "Indentation exceeds maximum depth of " + options.getMaxDepth(),
              line);
        }
        levels.push(new Level(indent, last.children));
      } else if (indent < levels.peek().indent) {
        Level closed = null;
        while (levels.size() > 1 && indent < levels.peek().indent) {
          closed = levels.pop();
        }
        if (indent != levels.peek().indent) {
          LOG.debug(
              "Line {} dedents between levels {} and {}; keeping it in the inner run",
              line.lineNum,
              levels.peek().indent,
              closed.indent);
          levels.push(closed);
        }
      }

      RawItem item = itemParser.parseLine(line, levels.size() - 1);
      levels.peek().items.add(item);
      last = item;
    }

    return roots;
  }

  private LinoException error(LinoException.Kind kind, String message, LogicalLine line) {
    return new LinoException(kind, message, filename, SourcePosition.of(text, line.start));
  }
}
