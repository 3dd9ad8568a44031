package elmfmt.exports;

import elmfmt.errors.Issue;
import elmfmt.errors.IssueVisitor;

public class UnresolvedDocTagIssue extends Issue {
	private final String tag;

	public UnresolvedDocTagIssue(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
