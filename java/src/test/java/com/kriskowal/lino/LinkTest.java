package com.kriskowal.lino;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

public class LinkTest {

  private static final Link SOME_EXAMPLE =
      Link.multi(Arrays.asList("some", "example"), Collections.singletonList(Link.of("value")));

  @Test
  void testIdentifierShapes() {
    assertEquals(Identifier.Kind.NONE, Identifier.of(null).getKind());
    assertEquals(Identifier.Kind.NONE, Identifier.of(Collections.emptyList()).getKind());
    assertEquals(Identifier.Kind.SINGLE, Identifier.of(Arrays.asList("a")).getKind());
    assertEquals(Identifier.Kind.MULTI, Identifier.of(Arrays.asList("a", "b")).getKind());
    assertThrows(
        IllegalArgumentException.class, () -> Identifier.multi(Collections.singletonList("a")));
    assertThrows(IllegalArgumentException.class, () -> Identifier.single(null));
  }

  @Test
  void testEmptyReferenceIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Identifier.single(""));
    assertThrows(IllegalArgumentException.class, () -> Identifier.multi(Arrays.asList("a", "")));
    assertThrows(IllegalArgumentException.class, () -> Link.of("", Link.of("v")));
    assertThrows(IllegalArgumentException.class, () -> Link.of(""));
  }

  @Test
  void testIdentifierAccessors() {
    assertNull(Identifier.NONE.single());
    assertNull(Identifier.NONE.joined());
    assertTrue(Identifier.NONE.references().isEmpty());
    assertEquals("a", Identifier.single("a").single());
    assertEquals("a b", Identifier.multi(Arrays.asList("a", "b")).joined());
  }

  @Test
  void testGetIdOnMultiReference() {
    MultiReferenceException e = assertThrows(MultiReferenceException.class, SOME_EXAMPLE::getId);
    assertEquals(2, e.getReferenceCount());
    assertEquals(
        "This link has a multi-reference id with 2 parts. Use 'getIds()' instead of 'getId()'.",
        e.getMessage());
    assertEquals(Arrays.asList("some", "example"), SOME_EXAMPLE.getIds());
    assertEquals("some example", SOME_EXAMPLE.getIdString());
  }

  @Test
  void testAnonymousLink() {
    Link link = Link.anonymous(Link.of("a"));
    assertNull(link.getId());
    assertNull(link.getIds());
    assertNull(link.getIdString());
    assertFalse(link.isLeaf());
    assertFalse(link.isEmpty());
    assertTrue(Link.empty().isEmpty());
    assertTrue(Link.of("a").isLeaf());
  }

  @Test
  void testMultiAndQuotedIdentifiersDiffer() {
    Link quoted = Link.of("some example", Link.of("value"));
    assertNotEquals(SOME_EXAMPLE, quoted);
    assertEquals(SOME_EXAMPLE.getIdString(), quoted.getIdString());
  }

  @Test
  void testEqualityIsStructural() {
    Link a = Link.of("id", Link.of("x"), Link.anonymous(Link.of("y")));
    Link b = Link.of("id", Arrays.asList(Link.of("x"), Link.anonymous(Link.of("y"))));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, Link.of("id", Link.of("x"), Link.of("y")));
    assertEquals(Link.empty(), new Link(null, null));
  }

  @Test
  void testValuesAreImmutable() {
    List<Link> values = new ArrayList<>(Arrays.asList(Link.of("a")));
    Link link = Link.of("id", values);
    values.add(Link.of("b"));
    assertEquals(1, link.getValues().size());
    assertThrows(UnsupportedOperationException.class, () -> link.getValues().add(Link.of("c")));
  }

  @Test
  void testNullValueIsRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> Link.anonymous(Arrays.asList(Link.of("a"), null)));
  }

  @Test
  void testValuesString() {
    Link link = Link.of("id", Link.of("a"), Link.of("x", Link.of("y")), Link.of("b c"));
    assertEquals("a (x: y) 'b c'", link.getValuesString());
    assertEquals("", Link.empty().toLinkOrIdString());
    assertEquals("(x: y)", Link.of("x", Link.of("y")).toLinkOrIdString());
  }

  @Test
  void testSimplify() {
    Link leaf = Link.of("a");
    assertSame(leaf, leaf.simplify());
    assertEquals(leaf, Link.anonymous(leaf).simplify());
    assertEquals(
        Link.of("id", Link.of("a"), Link.of("c")),
        Link.of("id", Link.of("a"), Link.of("b", Link.of("c"))).simplify());
  }

  @Test
  void testCombine() {
    Link a = Link.of("a");
    Link b = Link.of("b");
    assertEquals(Link.anonymous(a, b), a.combine(b));
    assertEquals("(a b)", a.combine(b).toString());
  }
}
