package com.kriskowal.lino;

/**
 * Immutable options controlling how links are rendered.
 *
 * <p>Defaults: parentheses everywhere, two-space indentation, inline layout preferred, no
 * reference-count or line-length thresholds, no grouping, multi-word identifiers written as bare
 * words.
 */
public final class FormatConfig {

  public static final FormatConfig DEFAULT = builder().build();

  private final boolean lessParentheses;
  private final String indentString;
  private final boolean preferInline;
  private final Integer maxInlineRefs;
  private final int maxLineLength;
  private final boolean indentLongLines;
  private final boolean groupConsecutive;
  private final boolean quoteMultiReferences;

  private FormatConfig(Builder builder) {
    this.lessParentheses = builder.lessParentheses;
    this.indentString = builder.indentString;
    this.preferInline = builder.preferInline;
    this.maxInlineRefs = builder.maxInlineRefs;
    this.maxLineLength = builder.maxLineLength;
    this.indentLongLines = builder.indentLongLines;
    this.groupConsecutive = builder.groupConsecutive;
    this.quoteMultiReferences = builder.quoteMultiReferences;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized from this configuration. */
  public Builder toBuilder() {
    return new Builder()
        .lessParentheses(lessParentheses)
        .indentString(indentString)
        .preferInline(preferInline)
        .maxInlineRefs(maxInlineRefs)
        .maxLineLength(maxLineLength)
        .indentLongLines(indentLongLines)
        .groupConsecutive(groupConsecutive)
        .quoteMultiReferences(quoteMultiReferences);
  }

  public boolean isLessParentheses() {
    return lessParentheses;
  }

  public String getIndentString() {
    return indentString;
  }

  public boolean isPreferInline() {
    return preferInline;
  }

  /** Maximum number of values rendered inline, or null for no limit. */
  public Integer getMaxInlineRefs() {
    return maxInlineRefs;
  }

  public int getMaxLineLength() {
    return maxLineLength;
  }

  public boolean isIndentLongLines() {
    return indentLongLines;
  }

  public boolean isGroupConsecutive() {
    return groupConsecutive;
  }

  public boolean isQuoteMultiReferences() {
    return quoteMultiReferences;
  }

  /** True when long-line indentation is on and {@code line} has more code points than allowed. */
  public boolean shouldIndentByLength(String line) {
    if (!indentLongLines) {
      return false;
    }
    return line.codePointCount(0, line.length()) > maxLineLength;
  }

  /** True when a reference limit is set and {@code refCount} exceeds it. */
  public boolean shouldIndentByRefCount(int refCount) {
    return maxInlineRefs != null && refCount > maxInlineRefs;
  }

  /** Builder for {@link FormatConfig}. */
  public static final class Builder {
    private boolean lessParentheses = false;
    private String indentString = "  ";
    private boolean preferInline = true;
    private Integer maxInlineRefs = null;
    private int maxLineLength = 80;
    private boolean indentLongLines = false;
    private boolean groupConsecutive = false;
    private boolean quoteMultiReferences = false;

    private Builder() {}

    public Builder lessParentheses(boolean value) {
      this.lessParentheses = value;
      return this;
    }

    public Builder indentString(String value) {
      if (value == null) {
        throw new IllegalArgumentException("Indent string must not be null");
      }
      this.indentString = value;
      return this;
    }

    public Builder preferInline(boolean value) {
      this.preferInline = value;
      return this;
    }

    public Builder maxInlineRefs(Integer value) {
      if (value != null && value < 0) {
        throw new IllegalArgumentException("maxInlineRefs must not be negative");
      }
      this.maxInlineRefs = value;
      return this;
    }

    public Builder maxLineLength(int value) {
      if (value < 0) {
        throw new IllegalArgumentException("maxLineLength must not be negative");
      }
      this.maxLineLength = value;
      return this;
    }

    public Builder indentLongLines(boolean value) {
      this.indentLongLines = value;
      return this;
    }

    public Builder groupConsecutive(boolean value) {
      this.groupConsecutive = value;
      return this;
    }

    public Builder quoteMultiReferences(boolean value) {
      this.quoteMultiReferences = value;
      return this;
    }

    public FormatConfig build() {
      return new FormatConfig(this);
    }
  }
}
