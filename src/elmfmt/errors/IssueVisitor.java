package elmfmt.errors;

import elmfmt.comment.MalformedCommentIssue;
import elmfmt.exports.UnresolvedDocTagIssue;
import elmfmt.fixity.UnknownFixityIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(MalformedCommentIssue malformedCommentIssue) throws E;
	public abstract T visit(UnresolvedDocTagIssue unresolvedDocTagIssue) throws E;
	public abstract T visit(UnknownFixityIssue unknownFixityIssue) throws E;
}
