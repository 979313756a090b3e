package com.kriskowal.lino;

import java.util.List;

/**
 * Links notation (Lino) parser and formatter.
 *
 * <p>The same link can be written three ways, all parsing to one link with identifier {@code id}
 * and values {@code v1 v2}:
 *
 * <pre>
 * (id: v1 v2)
 * id: v1 v2
 * id:
 *   v1
 *   v2
 * </pre>
 */
public final class Lino {

  private static final Parser DEFAULT_PARSER = new Parser();

  private Lino() {}

  /** Parse links notation with default options. */
  public static List<Link> parse(String source) {
    return DEFAULT_PARSER.parse(source);
  }

  /** Parse links notation with filename for error messages. */
  public static List<Link> parse(String source, String filename) {
    return DEFAULT_PARSER.parse(source, filename);
  }

  /** Format links with the default configuration: one link per line, fully parenthesized. */
  public static String format(List<Link> links) {
    return Formatter.format(links, FormatConfig.DEFAULT);
  }

  public static String format(List<Link> links, FormatConfig config) {
    return Formatter.format(links, config);
  }
}
