package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the raw item tree into the canonical link forest.
 *
 * <p>An indented-id marker ({@code id:} followed by indented lines) becomes one link whose values
 * are its children. Any other item with indented children is flattened: the item itself and every
 * descendant are emitted as separate links, each nested inside its chain of ancestors the same way
 * explicit parentheses would nest it.
 */
final class TreeNormalizer {

  private TreeNormalizer() {}

  static List<Link> normalize(List<RawItem> items) {
    List<Link> result = new ArrayList<>();
    for (RawItem item : items) {
      collect(item, Collections.emptyList(), result);
    }
    return result;
  }

  private static void collect(RawItem item, List<Link> path, List<Link> result) {
    if (item.indentedMarker) {
      result.add(combine(path, markerLink(item)));
      return;
    }

    Link current = toLink(item);
    result.add(combine(path, current));
    if (item.children.isEmpty()) {
      return;
    }

    List<Link> childPath = new ArrayList<>(path.size() + 1);
    childPath.addAll(path);
    childPath.add(current);
    for (RawItem child : item.children) {
      collect(child, childPath, result);
    }
  }

  // A child line holding a single value contributes that value rather than a wrapper around it.
  private static Link markerLink(RawItem item) {
    List<Link> values = new ArrayList<>();
    for (RawItem child : item.children) {
      if (!child.indentedMarker && child.values.size() == 1 && child.children.isEmpty()) {
        values.add(toLink(child.values.get(0)));
      } else {
        collect(child, Collections.emptyList(), values);
      }
    }
    return new Link(item.identifier, values);
  }

  private static Link toLink(RawItem item) {
    List<Link> values = new ArrayList<>(item.values.size());
    for (RawItem value : item.values) {
      values.add(toLink(value));
    }
    return new Link(item.identifier, values);
  }

  /**
   * Nests {@code current} inside its ancestors: no ancestors leaves it unchanged, one ancestor
   * {@code a} gives {@code (a current)}, and more ancestors give {@code (combine(rest, last)
   * current)}.
   */
  static Link combine(List<Link> path, Link current) {
    if (path.isEmpty()) {
      return current;
    }
    if (path.size() == 1) {
      return Link.anonymous(path.get(0), current);
    }
    Link parent = combine(path.subList(0, path.size() - 1), path.get(path.size() - 1));
    return Link.anonymous(parent, current);
  }
}
