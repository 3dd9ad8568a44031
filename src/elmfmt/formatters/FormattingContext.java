package elmfmt.formatters;

import elmfmt.errors.Context;
import elmfmt.errors.IssueContext;

/**
 * Everything the syntax-tree formatters need besides the node itself: the page
 * width (for re-flowing comments), the operator fixities and where to report
 * issues. One instance serves one file.
 */
public class FormattingContext {
	private final int width;
	private final FixityResolver fixities;
	private final IssueContext issues;

	public FormattingContext(int width, FixityResolver fixities, IssueContext issues) {
		if (width <= 0) {
			throw new IllegalArgumentException("page width must be positive, got " + width);
		}
		this.width = width;
		this.fixities = fixities;
		this.issues = issues;
	}

	public int getWidth() {
		return width;
	}

	public FixityResolver getFixities() {
		return fixities;
	}

	public IssueContext getIssues() {
		return issues;
	}

	public FormattingContext withContext(Context context) {
		return new FormattingContext(width, fixities, issues.withContext(context));
	}
}
