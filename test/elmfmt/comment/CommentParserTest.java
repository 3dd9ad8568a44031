package elmfmt.comment;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import elmfmt.errors.TopLevelIssueContext;

public class CommentParserTest {

	private TopLevelIssueContext ctx;

	@Before
	public void setup() {
		ctx = new TopLevelIssueContext();
	}

	private static Comment comment(CommentPart... parts) {
		return new Comment(Arrays.asList(parts));
	}

	@Test
	public void testMarkdownAndTags() {
		Comment actual = CommentParser.parse(" Hello world.\n\n@docs foo, bar\n@docs baz\n", ctx);
		assertEquals(comment(
				new MarkdownPart("Hello world."),
				new DocTagsPart(Arrays.asList("foo", "bar")),
				new DocTagsPart(Arrays.asList("baz"))), actual);
		assertFalse(ctx.hasIssues());
	}

	@Test
	public void testFencedCode() {
		Comment actual = CommentParser.parse("Intro\n\n```\nx = 1\n```\n", ctx);
		assertEquals(comment(new MarkdownPart("Intro"), new CodePart("x = 1")), actual);
	}

	@Test
	public void testIndentedCodeAfterBlankLine() {
		Comment actual = CommentParser.parse("Intro\n\n    x = 1\n    y = 2\n\nAfter", ctx);
		assertEquals(comment(
				new MarkdownPart("Intro"),
				new CodePart("x = 1\ny = 2"),
				new MarkdownPart("After")), actual);
	}

	@Test
	public void testIndentedLineInsideParagraphIsMarkdown() {
		Comment actual = CommentParser.parse("Intro\n    continued", ctx);
		assertEquals(comment(new MarkdownPart("Intro\n    continued")), actual);
	}

	@Test
	public void testUnterminatedFence() {
		Comment actual = CommentParser.parse("Intro\n```\ncode", ctx);
		assertEquals(comment(new MarkdownPart("Intro\n```\ncode")), actual);
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(MalformedCommentIssue.class));
		assertThat(((MalformedCommentIssue) ctx.getIssues().get(0)).getLine(), is(1));
	}

	@Test
	public void testTagKeywordMustStandAlone() {
		assertTrue(CommentParser.isTagLine("@docs a"));
		assertTrue(CommentParser.isTagLine("@doc"));
		assertFalse(CommentParser.isTagLine("@docsa"));
		assertFalse(CommentParser.isTagLine("see @docs a"));
	}

	@Test
	public void testEmptyComment() {
		assertTrue(CommentParser.parse("", ctx).isEmpty());
		assertTrue(CommentParser.parse("   \n\n", ctx).isEmpty());
	}
}
