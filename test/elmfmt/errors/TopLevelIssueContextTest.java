package elmfmt.errors;

import static org.junit.Assert.*;

import org.junit.Test;

import elmfmt.comment.MalformedCommentIssue;
import elmfmt.fixity.UnknownFixityIssue;

public class TopLevelIssueContextTest {

	@Test
	public void testNestedContextsWrapIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		IssueContext nested = ctx
				.withContext(new WhileFormattingDeclaration("view"))
				.withContext(new WhileReadingDocComment("view"));
		nested.report(new MalformedCommentIssue("unterminated code block", 2));
		assertTrue(ctx.hasIssues());
		assertTrue(nested.hasIssues());
		assertEquals(
				"while formatting declaration view:\n" +
				"    while reading the doc comment of view:\n" +
				"        malformed comment at line 3: unterminated code block; the rest of the comment is kept as text",
				ctx.getIssues().get(0).getMessage());
	}

	@Test
	public void testFormatListsEveryIssue() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.report(new UnknownFixityIssue("<?>"));
		ctx.withContext(new WhileReadingDocComment(null)).report(new UnknownFixityIssue("<!>"));
		assertEquals(
				"Detected 2 issue(s):\n" +
				"no fixity known for operator (<?>); its operands were parenthesized\n" +
				"while reading the module doc comment:\n" +
				"    no fixity known for operator (<!>); its operands were parenthesized",
				ctx.format(100));
	}
}
