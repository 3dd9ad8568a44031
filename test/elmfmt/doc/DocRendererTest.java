package elmfmt.doc;

import static org.junit.Assert.*;
import static elmfmt.doc.DocBuilder.*;

import java.util.Arrays;

import org.junit.Test;

import elmfmt.InternalFormatterError;

public class DocRendererTest {

	private static String render(int width, Doc doc) {
		return new DocRenderer(width).render(doc);
	}

	private static Doc pair() {
		return group(concat(text("aaaa"), softline(), text("bbbb")));
	}

	@Test
	public void testFitsExactlyAtWidth() {
		assertEquals("aaaa bbbb", render(9, pair()));
	}

	@Test
	public void testBreaksOneColumnOver() {
		assertEquals("aaaa\nbbbb", render(8, pair()));
	}

	@Test
	public void testHardLineBreaksEnclosingGroup() {
		Doc doc = group(concat(text("x"), softline(), text("y"), hardline(), text("z")));
		assertEquals("x\ny\nz", render(80, doc));
	}

	@Test
	public void testTextAfterGroupCountsTowardsFit() {
		Doc doc = concat(group(concat(text("aa"), softline(), text("aa"))), text("bb"));
		assertEquals("aa aabb", render(7, doc));
		assertEquals("aa\naabb", render(6, doc));
	}

	@Test
	public void testNestIndentsBrokenLines() {
		Doc doc = group(concat(text("f"), nest(4, concat(softline(), text("x"), softline(), text("y")))));
		assertEquals("f x y", render(5, doc));
		assertEquals("f\n    x\n    y", render(4, doc));
	}

	@Test
	public void testInnerGroupStaysFlatWhenOuterBreaks() {
		Doc inner = group(concat(text("b"), softline(), text("c")));
		Doc doc = group(concat(text("aaaaaa"), nest(2, concat(softline(), inner))));
		assertEquals("aaaaaa\n  b c", render(8, doc));
	}

	@Test
	public void testBlankLinesCarryNoIndentation() {
		Doc doc = concat(text("a"), nest(4, concat(hardline(), hardline(), text("b"))));
		assertEquals("a\n\n    b", render(80, doc));
	}

	@Test
	public void testLiteralLineIgnoresNesting() {
		Doc doc = nest(4, concat(text("a"), literalline(), text("  b"), hardline(), text("c")));
		assertEquals("a\n  b\n    c", render(80, doc));
	}

	@Test
	public void testSoftbreakVanishesWhenFlat() {
		Doc doc = group(concat(
				text("[ "), text("a"), softbreak(), text(", "), text("b"), softline(), text("]")));
		assertEquals("[ a, b ]", render(80, doc));
		assertEquals("[ a\n, b\n]", render(5, doc));
	}

	@Test
	public void testOverlongTextOverflows() {
		assertEquals("abcdefghij", render(3, group(text("abcdefghij"))));
	}

	@Test
	public void testDerivedCombinators() {
		assertEquals("a b c", render(80, words(Arrays.asList(text("a"), text("b"), text("c")))));
		assertEquals("a\nb", render(80, lines(Arrays.asList(text("a"), text("b")))));
		assertEquals("a, b", render(80, join(text(", "), Arrays.asList(text("a"), text("b")))));
		assertEquals("", render(80, join(text(", "), Arrays.asList())));
	}

	@Test(expected = InternalFormatterError.class)
	public void testTextWithLineBreakIsRejected() {
		text("a\nb");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWidthMustBePositive() {
		new DocRenderer(0);
	}
}
