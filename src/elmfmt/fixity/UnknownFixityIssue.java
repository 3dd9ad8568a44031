package elmfmt.fixity;

import elmfmt.errors.Issue;
import elmfmt.errors.IssueVisitor;

public class UnknownFixityIssue extends Issue {
	private final String operator;

	public UnknownFixityIssue(String operator) {
		this.operator = operator;
	}

	public String getOperator() {
		return operator;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
