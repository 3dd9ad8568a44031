package elmfmt;

import java.util.List;

import elmfmt.errors.Issue;

/**
 * The formatted text of one file and the issues noticed while producing it.
 * Issues never prevent the text from being produced.
 */
public class FormatResult {
	private final String text;
	private final List<Issue> issues;

	public FormatResult(String text, List<Issue> issues) {
		this.text = text;
		this.issues = issues;
	}

	public String getText() {
		return text;
	}

	public List<Issue> getIssues() {
		return issues;
	}

	public boolean hasIssues() {
		return !issues.isEmpty();
	}
}
