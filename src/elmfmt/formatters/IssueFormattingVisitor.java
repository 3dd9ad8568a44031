package elmfmt.formatters;

import elmfmt.comment.MalformedCommentIssue;
import elmfmt.doc.Doc;
import elmfmt.errors.IssueVisitor;
import elmfmt.errors.IssueWithContext;
import elmfmt.exports.UnresolvedDocTagIssue;
import elmfmt.fixity.UnknownFixityIssue;

import static elmfmt.doc.DocBuilder.*;
import static elmfmt.formatters.FormattingTools.*;

public class IssueFormattingVisitor extends IssueVisitor<Doc, RuntimeException> {

	@Override
	public Doc visit(IssueWithContext issueWithContext) {
		return concat(
				issueWithContext.getContext().accept(new ContextFormattingVisitor()),
				nest(INDENT, concat(hardline(), issueWithContext.getIssue().accept(this))));
	}

	@Override
	public Doc visit(MalformedCommentIssue malformedCommentIssue) {
		return text("malformed comment at line " + (malformedCommentIssue.getLine() + 1) + ": "
				+ malformedCommentIssue.getProblem() + "; the rest of the comment is kept as text");
	}

	@Override
	public Doc visit(UnresolvedDocTagIssue unresolvedDocTagIssue) {
		return text("@doc tag " + unresolvedDocTagIssue.getTag()
				+ " does not name an exposed value or type and was left out of the export order");
	}

	@Override
	public Doc visit(UnknownFixityIssue unknownFixityIssue) {
		return text("no fixity known for operator (" + unknownFixityIssue.getOperator()
				+ "); its operands were parenthesized");
	}
}
