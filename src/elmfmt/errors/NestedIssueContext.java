package elmfmt.errors;

public class NestedIssueContext extends IssueContext {

	private final IssueContext parent;
	private final Context context;

	public NestedIssueContext(IssueContext parent, Context context) {
		this.parent = parent;
		this.context = context;
	}

	@Override
	public void report(Issue issue) {
		parent.report(issue.withContext(context));
	}

	@Override
	public boolean hasIssues() {
		return parent.hasIssues();
	}

}
