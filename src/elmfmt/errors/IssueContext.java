package elmfmt.errors;

public abstract class IssueContext {

	public abstract void report(Issue issue);

	public abstract boolean hasIssues();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
