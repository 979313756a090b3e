package com.kriskowal.lino;

/**
 * Thrown when links notation text cannot be parsed.
 *
 * <p>Every failure carries a {@link Kind}. A single malformed line fails the whole document; the
 * parser never returns a partial result.
 */
public class LinoException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The category of a parse failure. */
  public enum Kind {
    UNTERMINATED_QUOTE,
    UNBALANCED_PARENTHESES,
    INVALID_COLON_PLACEMENT,
    INVALID_IDENTIFIER,
    INPUT_TOO_LARGE,
    RECURSION_TOO_DEEP
  }

  private final Kind kind;
  private final int line;
  private final int col;

  public LinoException(Kind kind, String message, String filename, int line, int col) {
    super(
        message + " at " + line + ":" + col + (filename != null ? " of <" + filename + ">" : ""));
    this.kind = kind;
    this.line = line;
    this.col = col;
  }

  public LinoException(Kind kind, String message, String filename) {
    super(message + (filename != null ? " <" + filename + ">" : ""));
    this.kind = kind;
    this.line = -1;
    this.col = -1;
  }

  LinoException(Kind kind, String message, String filename, SourcePosition position) {
    this(kind, message, filename, position.line(), position.col());
  }

  public Kind getKind() {
    return kind;
  }

  /** 1-based line of the failure, or -1 when the failure is not tied to a position. */
  public int getLine() {
    return line;
  }

  /** 1-based column of the failure, or -1 when the failure is not tied to a position. */
  public int getCol() {
    return col;
  }
}
