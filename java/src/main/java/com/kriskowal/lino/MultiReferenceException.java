package com.kriskowal.lino;

/**
 * Thrown when a multi-reference identifier is read through a single-reference accessor such as
 * {@link Link#getId()} or {@link Identifier#single()}.
 *
 * <p>This is an API misuse, not a parse failure, so it is not a {@link LinoException}. Use {@link
 * Link#getIds()} or {@link Identifier#references()} instead.
 */
public class MultiReferenceException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int referenceCount;

  public MultiReferenceException(int referenceCount) {
    super(
        "This link has a multi-reference id with "
            + referenceCount
            + " parts. Use 'getIds()' instead of 'getId()'.");
    this.referenceCount = referenceCount;
  }

  public int getReferenceCount() {
    return referenceCount;
  }
}
