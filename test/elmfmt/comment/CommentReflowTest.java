package elmfmt.comment;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import elmfmt.errors.TopLevelIssueContext;

public class CommentReflowTest {

	private static Comment comment(CommentPart... parts) {
		return new Comment(Arrays.asList(parts));
	}

	@Test
	public void testGreedyWrap() {
		assertEquals("one two\nthree\nfour five",
				CommentReflow.reflow(comment(new MarkdownPart("one two three four five")), 9));
	}

	@Test
	public void testParagraphBreaksSurvive() {
		assertEquals("a b\n\nc",
				CommentReflow.reflow(comment(new MarkdownPart("a\nb\n\n\nc")), 80));
	}

	@Test
	public void testHeadingsStandAlone() {
		assertEquals("# Title\nsome text",
				CommentReflow.reflow(comment(new MarkdownPart("# Title\nsome text")), 80));
	}

	@Test
	public void testLongWordIsNotSplit() {
		assertEquals("a\nextraordinarily\nb",
				CommentReflow.reflow(comment(new MarkdownPart("a extraordinarily b")), 5));
	}

	@Test
	public void testCodeIsIndentedNotWrapped() {
		Comment c = comment(new MarkdownPart("Intro"), new CodePart("x = 1 + 2\n\ny"));
		assertEquals("Intro\n\n    x = 1 + 2\n\n    y", CommentReflow.reflow(c, 3));
	}

	@Test
	public void testFileCommentTags() {
		Comment c = comment(
				new MarkdownPart("Docs"),
				new DocTagsPart(Arrays.asList("foo", "bar")),
				new DocTagsPart(Arrays.asList("baz")));
		ReflowedComment actual = CommentReflow.reflowFileComment(c, 80);
		assertEquals("Docs\n\n@doc foo, bar\n\n@doc baz", actual.getText());
		assertEquals(Arrays.asList(Arrays.asList("foo", "bar"), Arrays.asList("baz")), actual.getTagGroups());
	}

	@Test
	public void testEmptyTagLine() {
		assertEquals("@doc", CommentReflow.reflow(comment(new DocTagsPart(Collections.emptyList())), 80));
	}

	@Test
	public void testListItemsKeepTheirLines() {
		assertEquals("- a\n- b\n1. c",
				CommentReflow.reflow(comment(new MarkdownPart("- a\n- b\n1. c")), 80));
	}

	@Test
	public void testListItemContinuationHangs() {
		assertEquals("- one two\n  three\n- four",
				CommentReflow.reflow(comment(new MarkdownPart("- one two three\n- four")), 9));
	}

	@Test
	public void testBlockWordsNeverStartAWrappedLine() {
		assertEquals("Mention the @docs\nkeyword here",
				CommentReflow.reflow(comment(new MarkdownPart("Mention the @docs keyword here")), 12));
		assertEquals("Wrap a ```fence\nword",
				CommentReflow.reflow(comment(new MarkdownPart("Wrap a ```fence word")), 7));
		assertEquals("see #12\nand -\nx",
				CommentReflow.reflow(comment(new MarkdownPart("see #12 and - x")), 4));
	}

	private static void assertStable(String raw, int width) {
		TopLevelIssueContext first = new TopLevelIssueContext();
		ReflowedComment once = CommentReflow.reflowFileComment(CommentParser.parse(raw, first), width);
		TopLevelIssueContext second = new TopLevelIssueContext();
		ReflowedComment twice = CommentReflow.reflowFileComment(CommentParser.parse(once.getText(), second), width);
		assertEquals(once.getText(), twice.getText());
		assertEquals(once.getTagGroups(), twice.getTagGroups());
		assertEquals(first.hasIssues(), second.hasIssues());
	}

	@Test
	public void testReflowIsStableUnderReparsing() {
		assertStable("Mention the @docs keyword here", 12);
		assertStable("Mention the @doc keyword here", 12);
		assertStable("Wrap a ```fence word", 7);
		assertStable("A list:\n\n- first item that wraps\n- second\n\n10. tenth item here", 10);
		assertStable("Intro text\n\n@docs foo, bar\n\n    x = 1\n\nsee #12 and - x", 6);
	}
}
