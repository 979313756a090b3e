package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses links notation text into links.
 *
 * <p>A parser only holds its {@link ParserOptions}; all state of a parse lives in objects created
 * for that call, so one instance can serve any number of threads.
 *
 * <p>Phases: the text is split into logical lines, the lines are arranged into a tree by
 * indentation while each line is parsed into a raw item, and the raw tree is normalized into
 * links.
 */
public final class Parser {

  private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

  private final ParserOptions options;

  public Parser() {
    this(ParserOptions.DEFAULT);
  }

  public Parser(ParserOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("Options must not be null");
    }
    this.options = options;
  }

  public ParserOptions getOptions() {
    return options;
  }

  public List<Link> parse(String source) {
    return parse(source, null);
  }

  /**
   * Parses a document.
   *
   * @param source the document text
   * @param filename name used in error messages, or null
   * @return the top-level links in document order
   * @throws LinoException if the text is malformed or exceeds a configured limit
   */
  public List<Link> parse(String source, String filename) {
    if (source == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    checkSize(source, filename);

    String text = source;
    if (options.getTokenizer() != null) {
      text = options.getTokenizer().tokenize(source);
    }
    if (text.trim().isEmpty()) {
      return new ArrayList<>();
    }

    List<LogicalLine> lines = LineSegmenter.segment(text, filename);
    List<RawItem> items = new IndentationTracker(text, filename, options).parseDocument(lines);
    List<Link> links = TreeNormalizer.normalize(items);

    LOG.debug(
        "Parsed {} links from {} logical lines{}",
        links.size(),
        lines.size(),
        filename != null ? " of " + filename : "");
    return links;
  }

  private void checkSize(String source, String filename) {
    int limit = options.getMaxInputSize();
    // UTF-8 needs at most three bytes per UTF-16 unit
    if ((long) source.length() * 3 <= limit) {
      return;
    }
    long bytes = utf8Length(source);
    if (bytes > limit) {
      throw new LinoException(
          LinoException.Kind.INPUT_TOO_LARGE,
          "Input size of " + bytes + " bytes exceeds maximum allowed size of " + limit + " bytes",
          filename);
    }
  }

  private static long utf8Length(String s) {
    long bytes = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c)
          && i + 1 < s.length()
          && Character.isLowSurrogate(s.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else {
        bytes += 3;
      }
    }
    return bytes;
  }
}
