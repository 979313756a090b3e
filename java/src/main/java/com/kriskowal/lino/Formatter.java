package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders links back to links notation text.
 *
 * <p>The formatter only depends on {@link Link}, {@link Identifier} and {@link FormatConfig}; it
 * never calls into the parser.
 */
public final class Formatter {

  private Formatter() {}

  /** Formats links one per line with the default configuration. */
  public static String format(List<Link> links) {
    return format(links, FormatConfig.DEFAULT);
  }

  /** Formats links one per line, grouping consecutive links first if configured. */
  public static String format(List<Link> links, FormatConfig config) {
    if (links == null || links.isEmpty()) {
      return "";
    }
    if (config == null) {
      config = FormatConfig.DEFAULT;
    }
    List<Link> toFormat = config.isGroupConsecutive() ? groupConsecutive(links) : links;

    StringBuilder out = new StringBuilder();
    for (int i = 0; i < toFormat.size(); i++) {
      if (i > 0) {
        out.append('\n');
      }
      out.append(formatOne(toFormat.get(i), config, false));
    }
    return out.toString();
  }

  /**
   * Formats a single link.
   *
   * @param isNestedValue true when the link is rendered as a value of an enclosing link; nested
   *     values always keep their parentheses and never switch to block layout
   */
  public static String formatOne(Link link, FormatConfig config, boolean isNestedValue) {
    Identifier id = link.getIdentifier();
    List<Link> values = link.getValues();
    boolean lessParentheses = config.isLessParentheses() && !isNestedValue;

    if (id.isNone() && values.isEmpty()) {
      return lessParentheses ? "" : "()";
    }

    if (values.isEmpty()) {
      String escapedId = escapeIdentifier(id, config);
      return lessParentheses && !needsParentheses(id, config) ? escapedId : "(" + escapedId + ")";
    }

    String inline = formatInline(link, config, lessParentheses);
    if (!isNestedValue && !config.isPreferInline() && shouldUseBlock(link, config, inline)) {
      return formatBlock(link, config);
    }
    return inline;
  }

  private static boolean shouldUseBlock(Link link, FormatConfig config, String inline) {
    return config.shouldIndentByRefCount(link.getValues().size())
        || config.shouldIndentByLength(inline);
  }

  private static String formatInline(Link link, FormatConfig config, boolean lessParentheses) {
    Identifier id = link.getIdentifier();
    String valuesStr = formatValues(link.getValues(), config);

    if (id.isNone()) {
      boolean bare = lessParentheses && link.getValues().stream().allMatch(Link::isLeaf);
      return bare ? valuesStr : "(" + valuesStr + ")";
    }

    String withColon = escapeIdentifier(id, config) + ": " + valuesStr;
    return lessParentheses && !needsParentheses(id, config) ? withColon : "(" + withColon + ")";
  }

  private static String formatBlock(Link link, FormatConfig config) {
    Identifier id = link.getIdentifier();
    List<String> lines = new ArrayList<>();
    if (!id.isNone()) {
      lines.add(escapeIdentifier(id, config) + ":");
    }
    for (Link value : link.getValues()) {
      lines.add(config.getIndentString() + formatValue(value, config));
    }
    return String.join("\n", lines);
  }

  private static String formatValues(List<Link> values, FormatConfig config) {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        out.append(' ');
      }
      out.append(formatValue(values.get(i), config));
    }
    return out.toString();
  }

  // A reference value is written bare; anything with structure keeps its parentheses.
  private static String formatValue(Link value, FormatConfig config) {
    if (value.isLeaf()) {
      Identifier id = value.getIdentifier();
      return id.isNone() ? "()" : escapeIdentifier(id, config);
    }
    return formatOne(value, config, true);
  }

  // ========================================================================
  // References
  // ========================================================================

  static String escapeIdentifier(Identifier id, FormatConfig config) {
    if (id.isNone()) {
      return "";
    }
    if (id.isMulti() && !config.isQuoteMultiReferences()) {
      StringBuilder out = new StringBuilder();
      for (String reference : id.references()) {
        if (out.length() > 0) {
          out.append(' ');
        }
        out.append(escapeReference(reference));
      }
      return out.toString();
    }
    return escapeReference(id.joined());
  }

  private static boolean needsParentheses(Identifier id, FormatConfig config) {
    if (id.isMulti() && !config.isQuoteMultiReferences()) {
      return true;
    }
    String joined = id.joined();
    return joined != null
        && (joined.contains(" ")
            || joined.contains(":")
            || joined.contains("(")
            || joined.contains(")"));
  }

  /**
   * Quotes a reference if it would not survive parsing as a bare word.
   *
   * <p>Single quotes are preferred. A reference containing only single quotes is wrapped in double
   * quotes. A reference containing both kinds is wrapped in a quote character it neither starts
   * nor ends with, repeated once more than the longest run of that character inside it.
   */
  public static String escapeReference(String reference) {
    if (reference == null || reference.isEmpty()) {
      return "";
    }

    boolean hasSingleQuote = reference.indexOf('\'') >= 0;
    boolean hasDoubleQuote = reference.indexOf('"') >= 0;

    if (hasSingleQuote && hasDoubleQuote) {
      return wrapMixedQuotes(reference);
    }
    if (hasDoubleQuote) {
      return "'" + reference + "'";
    }
    if (hasSingleQuote) {
      return "\"" + reference + "\"";
    }
    if (needsQuoting(reference)) {
      return "'" + reference + "'";
    }
    return reference;
  }

  // Uses a quote character the reference neither starts nor ends with, repeated once more than its
  // longest run inside the reference, so every inner run reads as literal text. Of the three quote
  // characters at most two can sit at the ends, so one always fits.
  private static String wrapMixedQuotes(String reference) {
    char first = reference.charAt(0);
    char last = reference.charAt(reference.length() - 1);
    for (char quote : new char[] {'`', '\'', '"'}) {
      if (first != quote && last != quote) {
        String delimiter = repeat(quote, longestRun(reference, quote) + 1);
        return delimiter + reference + delimiter;
      }
    }
    throw new IllegalStateException("No quote character fits " + reference);
  }

  private static int longestRun(String text, char c) {
    int longest = 0;
    int run = 0;
    for (int i = 0; i < text.length(); i++) {
      run = text.charAt(i) == c ? run + 1 : 0;
      longest = Math.max(longest, run);
    }
    return longest;
  }

  private static String repeat(char c, int count) {
    StringBuilder out = new StringBuilder(count);
    for (int i = 0; i < count; i++) {
      out.append(c);
    }
    return out.toString();
  }

  private static boolean needsQuoting(String reference) {
    for (int i = 0; i < reference.length(); i++) {
      switch (reference.charAt(i)) {
        case ' ':
        case '\t':
        case '\n':
        case '\r':
        case ':':
        case '(':
        case ')':
        case '`':
          return true;
        default:
          break;
      }
    }
    return false;
  }

  // ========================================================================
  // Grouping
  // ========================================================================

  /**
   * Merges each run of adjacent links that share an identifier and have values into one link
   * whose values are the concatenation of the run's values. Links that are not adjacent are never
   * merged.
   */
  static List<Link> groupConsecutive(List<Link> links) {
    List<Link> grouped = new ArrayList<>();
    int i = 0;
    while (i < links.size()) {
      Link current = links.get(i);
      if (!isGroupable(current)) {
        grouped.add(current);
        i++;
        continue;
      }

      List<Link> merged = new ArrayList<>(current.getValues());
      int j = i + 1;
      while (j < links.size()
          && isGroupable(links.get(j))
          && links.get(j).getIdentifier().equals(current.getIdentifier())) {
        merged.addAll(links.get(j).getValues());
        j++;
      }

      grouped.add(j > i + 1 ? new Link(current.getIdentifier(), merged) : current);
      i = j;
    }
    return grouped;
  }

  private static boolean isGroupable(Link link) {
    return !link.getIdentifier().isNone() && !link.isLeaf();
  }
}
