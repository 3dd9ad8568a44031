package elmfmt.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import elmfmt.doc.Doc;
import elmfmt.doc.DocRenderer;
import elmfmt.formatters.IssueFormattingVisitor;

import static elmfmt.doc.DocBuilder.*;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void report(Issue issue) {
		issues.add(issue);
	}

	@Override
	public boolean hasIssues() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public String format(int width) {
		List<Doc> docs = new ArrayList<>();
		docs.add(text("Detected " + issues.size() + " issue(s):"));
		for (Issue issue : issues) {
			docs.add(issue.accept(new IssueFormattingVisitor()));
		}
		return new DocRenderer(width).render(lines(docs));
	}
}
