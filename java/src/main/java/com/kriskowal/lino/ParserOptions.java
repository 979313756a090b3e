package com.kriskowal.lino;

/**
 * Immutable parser configuration: size and depth limits, strictness and optional
 * pre-tokenization.
 */
public final class ParserOptions {

  /**
   * How forgiving the parser is about ambiguous input.
   *
   * <p>{@code STRICT} rejects an empty identifier before {@code :} and a multi-word identifier
   * that mixes quoted and bare words. {@code LENIENT} reads the first as an anonymous link and the
   * second as a multi-word identifier.
   */
  public enum Strictness {
    STRICT,
    LENIENT
  }

  public static final int DEFAULT_MAX_INPUT_SIZE = 10 * 1024 * 1024;
  public static final int DEFAULT_MAX_DEPTH = 1000;

  public static final ParserOptions DEFAULT = builder().build();

  private final int maxInputSize;
  private final int maxDepth;
  private final Strictness strictness;
  private final Tokenizer tokenizer;

  private ParserOptions(Builder builder) {
    this.maxInputSize = builder.maxInputSize;
    this.maxDepth = builder.maxDepth;
    this.strictness = builder.strictness;
    this.tokenizer = builder.tokenizer;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Maximum input size in UTF-8 bytes. */
  public int getMaxInputSize() {
    return maxInputSize;
  }

  /** Maximum combined depth of indentation levels and nested parentheses. */
  public int getMaxDepth() {
    return maxDepth;
  }

  public Strictness getStrictness() {
    return strictness;
  }

  public boolean isStrict() {
    return strictness == Strictness.STRICT;
  }

  /** The tokenizer applied before parsing, or null. */
  public Tokenizer getTokenizer() {
    return tokenizer;
  }

  /** Builder for {@link ParserOptions}. */
  public static final class Builder {
    private int maxInputSize = DEFAULT_MAX_INPUT_SIZE;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private Strictness strictness = Strictness.STRICT;
    private Tokenizer tokenizer = null;

    private Builder() {}

    public Builder maxInputSize(int value) {
      if (value <= 0) {
        throw new IllegalArgumentException("maxInputSize must be positive");
      }
      this.maxInputSize = value;
      return this;
    }

    public Builder maxDepth(int value) {
      if (value <= 0) {
        throw new IllegalArgumentException("maxDepth must be positive");
      }
      this.maxDepth = value;
      return this;
    }

    public Builder strictness(Strictness value) {
      if (value == null) {
        throw new IllegalArgumentException("Strictness must not be null");
      }
      this.strictness = value;
      return this;
    }

    public Builder tokenizer(Tokenizer value) {
      this.tokenizer = value;
      return this;
    }

    public ParserOptions build() {
      return new ParserOptions(this);
    }
  }
}
