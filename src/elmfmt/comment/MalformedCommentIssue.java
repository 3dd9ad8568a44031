package elmfmt.comment;

import elmfmt.errors.Issue;
import elmfmt.errors.IssueVisitor;

public class MalformedCommentIssue extends Issue {
	private final String problem;
	private final int line;

	public MalformedCommentIssue(String problem, int line) {
		this.problem = problem;
		this.line = line;
	}

	public String getProblem() {
		return problem;
	}

	/**
	 * @return the 0-based line within the comment body where the problem starts
	 */
	public int getLine() {
		return line;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
