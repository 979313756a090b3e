package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A link in links notation: an optional {@link Identifier} and an ordered list of values.
 *
 * <p>A link with no values is a leaf: either a plain reference such as {@code papa} or the empty
 * link {@code ()}. Links are immutable; two links are equal when their identifiers are equal and
 * their values are equal in the same order.
 */
public final class Link {

  private static final Link EMPTY = new Link(Identifier.NONE, Collections.emptyList());

  private final Identifier identifier;
  private final List<Link> values;

  public Link(Identifier identifier, List<Link> values) {
    this.identifier = identifier != null ? identifier : Identifier.NONE;
    if (values == null || values.isEmpty()) {
      this.values = Collections.emptyList();
    } else {
      List<Link> copy = new ArrayList<>(values);
      for (Link value : copy) {
        if (value == null) {
          throw new IllegalArgumentException("Link values must not contain null");
        }
      }
      this.values = Collections.unmodifiableList(copy);
    }
  }

  /** The empty link, formatted as {@code ()}. */
  public static Link empty() {
    return EMPTY;
  }

  /** A plain reference with no values. */
  public static Link of(String id) {
    return new Link(Identifier.single(id), null);
  }

  public static Link of(String id, List<Link> values) {
    return new Link(id != null ? Identifier.single(id) : Identifier.NONE, values);
  }

  public static Link of(String id, Link... values) {
    return of(id, Arrays.asList(values));
  }

  /** A link with a multi-word identifier such as {@code some example}. */
  public static Link multi(List<String> ids, List<Link> values) {
    return new Link(Identifier.multi(ids), values);
  }

  /** A link without an identifier. */
  public static Link anonymous(List<Link> values) {
    return new Link(Identifier.NONE, values);
  }

  public static Link anonymous(Link... values) {
    return anonymous(Arrays.asList(values));
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  /**
   * Returns the single identifier, or null if the link has none.
   *
   * @throws MultiReferenceException if the identifier has more than one reference
   */
  public String getId() {
    return identifier.single();
  }

  /** Returns every identifier reference in order, or null if the link has no identifier. */
  public List<String> getIds() {
    return identifier.isNone() ? null : identifier.references();
  }

  /** Returns the identifier references joined by spaces, or null if the link has none. */
  public String getIdString() {
    return identifier.joined();
  }

  public List<Link> getValues() {
    return values;
  }

  public boolean isLeaf() {
    return values.isEmpty();
  }

  public boolean isEmpty() {
    return identifier.isNone() && values.isEmpty();
  }

  /** Space-separated rendering of the values, each as a reference or a parenthesized link. */
  public String getValuesString() {
    return values.stream().map(Link::toLinkOrIdString).collect(Collectors.joining(" "));
  }

  /** Renders a leaf as its escaped identifier and anything else as a full link. */
  public String toLinkOrIdString() {
    if (values.isEmpty()) {
      return identifier.isNone()
          ? ""
          : Formatter.escapeIdentifier(identifier, FormatConfig.DEFAULT);
    }
    return toString();
  }

  /**
   * Unwraps single-value containers: a link with exactly one value becomes that value, and a link
   * with several values keeps its identifier while each value is simplified in turn.
   */
  public Link simplify() {
    if (values.isEmpty()) {
      return this;
    }
    if (values.size() == 1) {
      return values.get(0);
    }
    List<Link> simplified = new ArrayList<>(values.size());
    for (Link value : values) {
      simplified.add(value.simplify());
    }
    return new Link(identifier, simplified);
  }

  /** Returns the anonymous link {@code (this other)}. */
  public Link combine(Link other) {
    return anonymous(this, other);
  }

  public String format(FormatConfig config) {
    return Formatter.formatOne(this, config, false);
  }

  public String format(boolean lessParentheses) {
    return format(FormatConfig.builder().lessParentheses(lessParentheses).build());
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) return true;
    if (!(other instanceof Link)) return false;
    Link link = (Link) other;
    return identifier.equals(link.identifier) && values.equals(link.values);
  }

  @Override
  public int hashCode() {
    return 31 * identifier.hashCode() + values.hashCode();
  }

  @Override
  public String toString() {
    return format(FormatConfig.DEFAULT);
  }
}
