package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The identifier of a link: none, a single reference, or an ordered multi-word reference.
 *
 * <p>A multi-word identifier only comes from an unquoted sequence of words before a colon, such as
 * {@code (some example: value)}. A quoted identifier is always single, even if it contains spaces.
 */
public final class Identifier {

  /** The shape of an identifier. */
  public enum Kind {
    NONE,
    SINGLE,
    MULTI
  }

  public static final Identifier NONE = new Identifier(Kind.NONE, Collections.emptyList());

  private final Kind kind;
  private final List<String> references;

  private Identifier(Kind kind, List<String> references) {
    this.kind = kind;
    this.references = references;
  }

  /** Creates a single-reference identifier; the reference must be non-empty. */
  public static Identifier single(String reference) {
    checkReference(reference);
    return new Identifier(Kind.SINGLE, Collections.singletonList(reference));
  }

  /** Creates a multi-word identifier; at least two references are required. */
  public static Identifier multi(List<String> references) {
    if (references == null || references.size() < 2) {
      throw new IllegalArgumentException("A multi-reference identifier needs at least two parts");
    }
    for (String reference : references) {
      checkReference(reference);
    }
    return new Identifier(Kind.MULTI, Collections.unmodifiableList(new ArrayList<>(references)));
  }

  /** Picks the matching shape for a reference list: empty or null is none, one is single. */
  public static Identifier of(List<String> references) {
    if (references == null || references.isEmpty()) {
      return NONE;
    }
    if (references.size() == 1) {
      return single(references.get(0));
    }
    return multi(references);
  }

  private static void checkReference(String reference) {
    if (reference == null) {
      throw new IllegalArgumentException("Reference must not be null");
    }
    if (reference.isEmpty()) {
      throw new IllegalArgumentException("Reference must not be empty");
    }
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isNone() {
    return kind == Kind.NONE;
  }

  public boolean isMulti() {
    return kind == Kind.MULTI;
  }

  /** All references of this identifier in order; empty for {@link #NONE}. */
  public List<String> references() {
    return references;
  }

  /**
   * Returns the single reference, or null for {@link #NONE}.
   *
   * @throws MultiReferenceException if this is a multi-word identifier
   */
  public String single() {
    switch (kind) {
      case NONE:
        return null;
      case SINGLE:
        return references.get(0);
      default:
        throw new MultiReferenceException(references.size());
    }
  }

  /** The references joined with a single space, or null for {@link #NONE}. */
  public String joined() {
    return isNone() ? null : String.join(" ", references);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) return true;
    if (!(other instanceof Identifier)) return false;
    Identifier that = (Identifier) other;
    return kind == that.kind && references.equals(that.references);
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + references.hashCode();
  }

  @Override
  public String toString() {
    switch (kind) {
      case NONE:
        return "None";
      case SINGLE:
        return "Single(" + references.get(0) + ")";
      default:
        return "Multi(" + references + ")";
    }
  }
}
