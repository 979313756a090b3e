package com.kriskowal.lino;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ParserTest {

  private static final Parser LENIENT =
      new Parser(ParserOptions.builder().strictness(ParserOptions.Strictness.LENIENT).build());

  // ========================================================================
  // Line shapes
  // ========================================================================

  @Test
  void testSeparateParenthesizedGroupsOnOneLine() {
    List<Link> links = Lino.parse("(a) (b)");
    assertEquals(
        Collections.singletonList(
            Link.anonymous(Link.anonymous(Link.of("a")), Link.anonymous(Link.of("b")))),
        links);
  }

  @Test
  void testNestedParenthesizedValues() {
    Link link = Lino.parse("(outer: (inner: a b) c)").get(0);
    Link inner = Link.of("inner", Link.of("a"), Link.of("b"));
    assertEquals(Link.of("outer", inner, Link.of("c")), link);
  }

  @Test
  void testQuotedIdentifierIsSingle() {
    Link link = Lino.parse("'some example': value").get(0);
    assertEquals(Identifier.Kind.SINGLE, link.getIdentifier().getKind());
    assertEquals("some example", link.getId());
  }

  @Test
  void testColonInsideQuotesIsNotASeparator() {
    Link link = Lino.parse("'a:b' c").get(0);
    assertEquals(Link.anonymous(Link.of("a:b"), Link.of("c")), link);
  }

  @Test
  void testEmptyParentheses() {
    assertEquals(Collections.singletonList(Link.empty()), Lino.parse("()"));
    assertEquals(Link.anonymous(Link.empty()), Lino.parse("(())").get(0));
  }

  @Test
  void testMarkerChildWithChildrenNests() {
    Link link = Lino.parse("a:\n  b:\n    c\n    d").get(0);
    assertEquals(Link.of("a", Link.of("b", Link.of("c"), Link.of("d"))), link);
  }

  @Test
  void testMarkerKeepsMultiValueChildLinesWhole() {
    Link link = Lino.parse("a:\n  b c\n  d").get(0);
    assertEquals(Link.of("a", Link.anonymous(Link.of("b"), Link.of("c")), Link.of("d")), link);
  }

  @Test
  void testDeepIndentationCombinesPaths() {
    List<Link> links = Lino.parse("a\n  b\n    c");
    Link a = Link.anonymous(Link.of("a"));
    Link b = Link.anonymous(Link.of("b"));
    Link c = Link.anonymous(Link.of("c"));
    assertEquals(Arrays.asList(a, a.combine(b), a.combine(b).combine(c)), links);
  }

  @Test
  void testDedentReturnsToEnclosingLevel() {
    List<Link> links = Lino.parse("a:\n  x\nb:\n  y");
    assertEquals(Arrays.asList(Link.of("a", Link.of("x")), Link.of("b", Link.of("y"))), links);
  }

  @Test
  void testDedentBetweenLevelsStaysInInnerRun() {
    String text = "a\n    b\n  c";
    assertEquals(Lino.parse("a\n    b\n    c"), Lino.parse(text));
    assertEquals(Lino.parse(text), LENIENT.parse(text));

    Link marker = Lino.parse("x:\n    b\n  c").get(0);
    assertEquals(Link.of("x", Link.of("b"), Link.of("c")), marker);
  }

  @Test
  void testDedentBetweenLevelsThenBackToRoot() {
    List<Link> links = Lino.parse("x:\n    b\n  c\ny: d");
    Link x = Link.of("x", Link.of("b"), Link.of("c"));
    assertEquals(Arrays.asList(x, Link.of("y", Link.of("d"))), links);
  }

  @Test
  void testTabsCountAsIndentation() {
    assertEquals(Lino.parse("id:\n  a\n  b"), Lino.parse("id:\n\ta\n\tb"));
  }

  // ========================================================================
  // Strictness
  // ========================================================================

  @Test
  void testMissingIdentifier() {
    LinoException e = assertThrows(LinoException.class, () -> Lino.parse("(: a)"));
    assertEquals(LinoException.Kind.INVALID_COLON_PLACEMENT, e.getKind());
    assertEquals(Link.anonymous(Link.of("a")), LENIENT.parse("(: a)").get(0));
  }

  @Test
  void testQuotedReferenceInMultiWordIdentifier() {
    LinoException e = assertThrows(LinoException.class, () -> Lino.parse("('a b' c: d)"));
    assertEquals(LinoException.Kind.INVALID_IDENTIFIER, e.getKind());

    Link link = LENIENT.parse("('a b' c: d)").get(0);
    assertEquals(Arrays.asList("a b", "c"), link.getIds());
  }

  @Test
  void testStrayColonIsAlwaysAnError() {
    LinoException e = assertThrows(LinoException.class, () -> LENIENT.parse("a: b: c"));
    assertEquals(LinoException.Kind.INVALID_COLON_PLACEMENT, e.getKind());
  }

  @Test
  void testStrayClosingParenthesisInValues() {
    // Unbalanced text never reaches the item parser: the segmenter rejects it first
    LinoException e = assertThrows(LinoException.class, () -> Lino.parse("(a))"));
    assertEquals(LinoException.Kind.UNBALANCED_PARENTHESES, e.getKind());
  }

  // ========================================================================
  // Limits
  // ========================================================================

  @Test
  void testInputSizeLimit() {
    Parser parser = new Parser(ParserOptions.builder().maxInputSize(10).build());
    assertEquals(1, parser.parse("aaaaaaaaaa").size());

    LinoException e = assertThrows(LinoException.class, () -> parser.parse("aaaaaaaaaaa"));
    assertEquals(LinoException.Kind.INPUT_TOO_LARGE, e.getKind());
    assertEquals(-1, e.getLine());
  }

  @Test
  void testInputSizeCountsUtf8Bytes() {
    Parser parser = new Parser(ParserOptions.builder().maxInputSize(10).build());
    assertEquals(1, parser.parse("\u00e9\u00e9\u00e9\u00e9\u00e9").size());
    assertThrows(LinoException.class, () -> parser.parse("\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9"));
  }

  @Test
  void testParenthesisDepthLimit() {
    Parser parser = new Parser(ParserOptions.builder().maxDepth(2).build());
    assertEquals(1, parser.parse("((a))").size());

    LinoException e = assertThrows(LinoException.class, () -> parser.parse("(((a)))"));
    assertEquals(LinoException.Kind.RECURSION_TOO_DEEP, e.getKind());
  }

  @Test
  void testIndentationDepthLimit() {
    Parser parser = new Parser(ParserOptions.builder().maxDepth(2).build());
    assertEquals(3, parser.parse("a\n b\n  c").size());

    LinoException e = assertThrows(LinoException.class, () -> parser.parse("a\n b\n  c\n   d"));
    assertEquals(LinoException.Kind.RECURSION_TOO_DEEP, e.getKind());
    assertEquals(4, e.getLine());
  }

  @Test
  void testDefaultLimitsAcceptDeepNesting() {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 500; i++) {
      text.append('(');
    }
    text.append('x');
    for (int i = 0; i < 500; i++) {
      text.append(')');
    }
    assertEquals(1, Lino.parse(text.toString()).size());
  }

  // ========================================================================
  // Options
  // ========================================================================

  @Test
  void testDefaultOptions() {
    ParserOptions options = new Parser().getOptions();
    assertEquals(ParserOptions.DEFAULT_MAX_INPUT_SIZE, options.getMaxInputSize());
    assertEquals(ParserOptions.DEFAULT_MAX_DEPTH, options.getMaxDepth());
    assertEquals(ParserOptions.Strictness.STRICT, options.getStrictness());
    assertTrue(options.isStrict());
    assertNull(options.getTokenizer());
  }

  @Test
  void testInvalidOptions() {
    assertThrows(IllegalArgumentException.class, () -> ParserOptions.builder().maxDepth(0));
    assertThrows(IllegalArgumentException.class, () -> ParserOptions.builder().maxInputSize(-1));
    assertThrows(IllegalArgumentException.class, () -> new Parser(null));
  }

  @Test
  void testTokenizerOption() {
    Parser parser = new Parser(ParserOptions.builder().tokenizer(new Tokenizer()).build());
    Link link = parser.parse("sum: 1+2").get(0);
    assertEquals(Link.of("sum", Link.of("1"), Link.of("+"), Link.of("2")), link);
  }
}
