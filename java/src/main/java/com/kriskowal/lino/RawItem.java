package com.kriskowal.lino;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed item before normalization. Inline values (written on the same line or inside
 * parentheses) are kept apart from children (supplied by indentation).
 */
final class RawItem {
  final Identifier identifier;
  final List<RawItem> values;
  final List<RawItem> children = new ArrayList<>();
  final boolean indentedMarker;

  RawItem(Identifier identifier, List<RawItem> values, boolean indentedMarker) {
    this.identifier = identifier;
    this.values = values;
    this.indentedMarker = indentedMarker;
  }

  static RawItem reference(String value) {
    return new RawItem(Identifier.single(value), Collections.emptyList(), false);
  }

  static RawItem marker(Identifier identifier) {
    return new RawItem(identifier, Collections.emptyList(), true);
  }
}
