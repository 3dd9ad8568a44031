package elmfmt.exports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import elmfmt.errors.Issue;

public class ExportOrdering {
	private final List<String> orderedNames;
	private final List<Issue> issues;

	public ExportOrdering(List<String> orderedNames, List<Issue> issues) {
		this.orderedNames = Collections.unmodifiableList(new ArrayList<>(orderedNames));
		this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
	}

	public List<String> getOrderedNames() {
		return orderedNames;
	}

	public List<Issue> getIssues() {
		return issues;
	}
}
