package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the content of one logical line into a {@link RawItem}.
 *
 * <p>Shapes are tried in order: a fully parenthesized link {@code (id: values)} or {@code
 * (values)}, an indented-id marker {@code id:}, a single-line link {@code id: values}, and finally
 * a bare list of values.
 */
final class ItemParser {

  private static final Logger LOG = LoggerFactory.getLogger(ItemParser.class);

  private final String text;
  private final String filename;
  private final ParserOptions options;

  ItemParser(String text, String filename, ParserOptions options) {
    this.text = text;
    this.filename = filename;
    this.options = options;
  }

  RawItem parseLine(LogicalLine line, int depth) {
    int start = line.start;
    int end = line.end;
    checkDepth(depth, start);

    if (text.charAt(start) == '(' && findClosingParen(start, end) == end - 1) {
      return parseParenthesized(start + 1, end - 1, depth + 1);
    }

    int colon = findTopLevelColon(start, end);
    if (colon == end - 1) {
      return RawItem.marker(parseIdentifier(start, colon));
    }
    if (colon >= 0) {
      return new RawItem(parseIdentifier(start, colon), parseValues(colon + 1, end, depth), false);
    }
    return new RawItem(Identifier.NONE, parseValues(start, end, depth), false);
  }

  // ====================================================================
  // Links and values
  // ====================================================================

  private RawItem parseParenthesized(int start, int end, int depth) {
    checkDepth(depth, start - 1);
    int colon = findTopLevelColon(start, end);
    if (colon >= 0) {
      return new RawItem(parseIdentifier(start, colon), parseValues(colon + 1, end, depth), false);
    }
    return new RawItem(Identifier.NONE, parseValues(start, end, depth), false);
  }

  private List<RawItem> parseValues(int start, int end, int depth) {
    List<RawItem> values = new ArrayList<>();
    int i = start;
    while (i < end) {
      char c = text.charAt(i);
      if (ReferenceScanner.isWhitespace(c)) {
        i++;
      } else if (c == '(') {
        int close = findClosingParen(i, end);
        if (close < 0) {
          throw error(LinoException.Kind.UNBALANCED_PARENTHESES, "Unclosed \"(\"", i);
        }
        values.add(parseParenthesized(i + 1, close, depth + 1));
        i = close + 1;
      } else if (c == ')') {
        throw error(LinoException.Kind.UNBALANCED_PARENTHESES, "Unexpected \")\"", i);
      } else if (c == ':') {
        throw error(LinoException.Kind.INVALID_COLON_PLACEMENT, "Unexpected \":\"", i);
      } else {
        ReferenceScanner.ScannedReference ref = ReferenceScanner.scan(text, i, end, filename);
        values.add(RawItem.reference(ref.value));
        i = ref.end;
      }
    }
    return values;
  }

  private Identifier parseIdentifier(int start, int colon) {
    List<String> references = new ArrayList<>();
    boolean anyQuoted = false;
    int i = start;
    while (i < colon) {
      char c = text.charAt(i);
      if (ReferenceScanner.isWhitespace(c)) {
        i++;
        continue;
      }
      ReferenceScanner.ScannedReference ref = ReferenceScanner.scan(text, i, colon, filename);
      if (ref == null) {
        throw error(
            LinoException.Kind.INVALID_IDENTIFIER, "Unexpected \"" + c + "\" in identifier", i);
      }
      references.add(ref.value);
      anyQuoted |= ref.quoted;
      i = ref.end;
    }

    if (references.isEmpty()) {
      if (options.isStrict()) {
        throw error(
            LinoException.Kind.INVALID_COLON_PLACEMENT, "Missing identifier before \":\"", colon);
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Reading empty identifier at {} as an anonymous link", position(colon));
      }
      return Identifier.NONE;
    }
    if (references.size() == 1) {
      return Identifier.single(references.get(0));
    }
    if (anyQuoted) {
      if (options.isStrict()) {
        throw error(
            LinoException.Kind.INVALID_IDENTIFIER,
            "Quoted reference in multi-word identifier",
            start);
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Accepting mixed quoted multi-word identifier at {}", position(start));
      }
    }
    return Identifier.multi(references);
  }

  // ====================================================================
  // Utility Methods
  // ====================================================================

  // Offset just past the token at i; quoted references and simple words are skipped whole.
  private int skipToken(int i, int end) {
    ReferenceScanner.ScannedReference ref = ReferenceScanner.scan(text, i, end, filename);
    return ref != null ? ref.end : i + 1;
  }

  private int findTopLevelColon(int start, int end) {
    int depth = 0;
    int i = start;
    while (i < end) {
      char c = text.charAt(i);
      if (ReferenceScanner.isWhitespace(c)) {
        i++;
      } else if (c == '(') {
        depth++;
        i++;
      } else if (c == ')') {
        depth--;
        i++;
      } else if (c == ':') {
        if (depth == 0) {
          return i;
        }
        i++;
      } else {
        i = skipToken(i, end);
      }
    }
    return -1;
  }

  private int findClosingParen(int open, int end) {
    int depth = 0;
    int i = open;
    while (i < end) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
        i++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
        i++;
      } else if (ReferenceScanner.isDelimiter(c)) {
        i++;
      } else {
        i = skipToken(i, end);
      }
    }
    return -1;
  }

  private void checkDepth(int depth, int offset) {
    if (depth > options.getMaxDepth()) {
      throw error(
          LinoException.Kind.RECURSION_TOO_DEEP,
          "Nesting exceeds maximum depth of " + options.getMaxDepth(),
          offset);
    }
  }

  private SourcePosition position(int offset) {
    return SourcePosition.of(text, offset);
  }

  private LinoException error(LinoException.Kind kind, String message, int offset) {
    return new LinoException(kind, message, filename, position(offset));
  }
}
